package io.serveritems.attributes;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeSchemaTest {

    private static AttributeSchema schemaWithNesting() {
        ItemAttribute name = new ItemAttribute("name", AttributeType.STRING, "General", Placement.TAG, null, null, null);
        ItemAttribute ticks = new ItemAttribute("ticks", AttributeType.NUMBER, "Field", null, 2, null, null);
        ItemAttribute damage = new ItemAttribute("damage", AttributeType.NUMBER, "Field", null, null, null, null);
        ItemAttribute field = new ItemAttribute("field", AttributeType.MIXED, "Field", null, 1, List.of("fire", "energy"), List.of(ticks, damage));
        ItemAttribute weight = ItemAttribute.of("weight", AttributeType.NUMBER, "General");
        return new AttributeSchema("custom", null, null, null, List.of(name, field, weight));
    }

    @Test
    void appliesDefaults() {
        AttributeSchema schema = schemaWithNesting();

        assertThat(schema.displayName()).isEqualTo("custom");
        assertThat(schema.fromToIdSupported()).isTrue();
        assertThat(schema.itemsXmlEncoding()).isEqualTo("iso-8859-1");
        assertThat(schema.attributes().get(2).placement()).isEqualTo(Placement.NESTED);
        assertThat(schema.attributes().get(2).hasExplicitOrder()).isFalse();
    }

    @Test
    void flattensNestedKeysDepthFirst() {
        AttributeSchema schema = schemaWithNesting();

        assertThat(schema.attributeKeysInOrder()).containsExactly("name", "field", "ticks", "damage", "weight");
        assertThat(schema.nestedAttributeKeys()).containsExactly("field", "ticks", "damage", "weight");
    }

    @Test
    void priorityIncludesNestedExplicitOrders() {
        assertThat(schemaWithNesting().attributePriority())
                .containsExactly(Map.entry("field", 1), Map.entry("ticks", 2));
    }

    @Test
    void categoriesInDefinitionOrder() {
        assertThat(schemaWithNesting().categories()).containsExactly("General", "Field");
    }
}
