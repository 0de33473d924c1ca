package io.serveritems.attributes;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeSchemaRegistryTest {

    private AttributeSchemaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = AttributeSchemaRegistry.defaultRegistry();
    }

    @Test
    void bundlesEightSortedServers() {
        assertThat(registry.availableServers()).containsExactly(
                "tfs0.3.6", "tfs0.4", "tfs0.5", "tfs1.0", "tfs1.1", "tfs1.2", "tfs1.4", "tfs1.6");
        List<AttributeSchemaRegistry.ServerLabel> labels = registry.availableServersWithLabels();
        assertThat(labels.get(0)).isEqualTo(new AttributeSchemaRegistry.ServerLabel("tfs0.3.6", "TFS 0.3.6"));
        assertThat(labels.get(7)).isEqualTo(new AttributeSchemaRegistry.ServerLabel("tfs1.6", "TFS 1.6"));
    }

    @Test
    void attributeCountsPerServer() {
        Map<String, Integer> expected = Map.of(
                "tfs0.3.6", 160, "tfs0.4", 161, "tfs0.5", 161, "tfs1.0", 109,
                "tfs1.1", 105, "tfs1.2", 105, "tfs1.4", 111, "tfs1.6", 153);
        expected.forEach((server, count) ->
                assertThat(registry.find(server).orElseThrow().attributes()).as(server).hasSize(count));
    }

    @Test
    void rangeSupportAndEncodingPerServer() {
        assertThat(registry.supportsFromToId("tfs0.3.6")).isFalse();
        for (String server : List.of("tfs0.4", "tfs0.5", "tfs1.0", "tfs1.1", "tfs1.2", "tfs1.4", "tfs1.6")) {
            assertThat(registry.supportsFromToId(server)).as(server).isTrue();
        }
        assertThat(registry.itemsXmlEncoding("tfs1.4")).isEqualTo("iso-8859-1");
        assertThat(registry.itemsXmlEncoding("tfs1.6")).isEqualTo("iso-8859-1");
        assertThat(registry.itemsXmlEncoding("tfs1.0")).isEqualTo("utf-8");
        assertThat(registry.itemsXmlEncoding("tfs0.3.6")).isEqualTo("utf-8");
    }

    @Test
    void defaultsWhenNothingSelected() {
        assertThat(registry.currentServer()).isNull();
        assertThat(registry.attributes()).isNull();
        assertThat(registry.categories()).isEmpty();
        assertThat(registry.supportsFromToId()).isTrue();
        assertThat(registry.itemsXmlEncoding()).isEqualTo("iso-8859-1");
        assertThat(registry.displayName("unknown")).isEqualTo("unknown");
    }

    @Test
    void loadServerMovesSelector() {
        List<ItemAttribute> attrs = registry.loadServer("tfs1.4");

        assertThat(attrs).hasSize(111);
        assertThat(registry.currentServer()).isEqualTo("tfs1.4");

        registry.loadServer("tfs0.3.6");
        assertThat(registry.supportsFromToId()).isFalse();
        assertThat(registry.itemsXmlEncoding()).isEqualTo("utf-8");

        registry.reset();
        assertThat(registry.currentServer()).isNull();
    }

    @Test
    void unknownServerIsNonFatal() {
        assertThat(registry.loadServer("nope")).isNull();
        assertThat(registry.currentServer()).isNull();

        registry.loadServer("tfs1.0");
        registry.loadServer("nope");
        assertThat(registry.currentServer()).isEqualTo("tfs1.0");
    }

    @Test
    void tagPlacementOnlyInNewerDialects() {
        registry.loadServer("tfs1.4");
        assertThat(registry.tagAttributeKeys()).containsExactly("article", "name", "plural", "editorsuffix");

        registry.loadServer("tfs1.0");
        assertThat(registry.tagAttributeKeys()).isEmpty();
    }

    @Test
    void dialectsRenameAttributes() {
        List<String> old = registry.find("tfs0.3.6").orElseThrow().attributeKeysInOrder();
        List<String> modern = registry.find("tfs1.0").orElseThrow().attributeKeysInOrder();

        assertThat(old).contains("extraDefense", "runespellname", "preventLoss").doesNotContain("extraDef", "dualWield");
        assertThat(modern).contains("extraDef", "runeSpellName", "maxHitPoints").doesNotContain("extraDefense");
        assertThat(registry.find("tfs0.4").orElseThrow().attributeKeysInOrder()).contains("dualWield");
    }

    @Test
    void categoriesAreDistinctInDefinitionOrder() {
        registry.loadServer("tfs1.6");

        List<String> categories = registry.categories();

        assertThat(categories).doesNotHaveDuplicates().contains("Boost Percent", "Magic Level Boost");
        assertThat(categories.get(0)).isEqualTo("General");
        assertThat(registry.attributesByCategory("General")).allMatch(a -> a.category().equals("General"));
    }

    @Test
    void podiumIsATypeValueInTfs16() {
        ItemAttribute type = registry.find("tfs1.6").orElseThrow().attributes().stream()
                .filter(a -> a.key().equals("type"))
                .findFirst()
                .orElseThrow();

        assertThat(type.values()).contains("podium");
    }

    @Test
    void searchIsCaseInsensitiveSubstring() {
        registry.loadServer("tfs1.6");

        assertThat(registry.searchAttributes("LEECH")).extracting(ItemAttribute::key)
                .contains("lifeLeechChance", "manaLeechAmount");
        assertThat(registry.searchAttributes("zzzz")).isEmpty();
    }

    @Test
    void bundledSchemasDeclareNoExplicitOrder() {
        registry.loadServer("tfs1.4");

        assertThat(registry.attributePriority()).isEmpty();
    }

    @Test
    void metadataForKnownServerOnly() {
        assertThat(registry.metadata("tfs1.4")).contains(
                new AttributeSchemaMetadata("tfs1.4", "TFS 1.4", true, "iso-8859-1"));
        assertThat(registry.metadata("nope")).isEmpty();
    }
}
