package io.serveritems.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServerItemListTest {

    @Test
    void emptyListReportsDefaultBoundaries() {
        ServerItemList list = new ServerItemList();

        assertThat(list.minId()).isEqualTo(100);
        assertThat(list.maxId()).isEqualTo(100);
        assertThat(list.size()).isZero();
    }

    @Test
    void indexesByIdAndClientId() {
        ServerItemList list = new ServerItemList();
        ServerItem a = new ServerItem(100, 500);
        ServerItem b = new ServerItem(101, 500);
        ServerItem c = new ServerItem(102, 501);
        list.add(a);
        list.add(b);
        list.add(c);

        assertThat(list.getById(101)).isSameAs(b);
        assertThat(list.getByClientId(500)).containsExactly(a, b);
        assertThat(list.getFirstByClientId(500)).isSameAs(a);
        assertThat(list.getByClientId(999)).isEmpty();
        assertThat(list.hasClientId(501)).isTrue();
        assertThat(list.maxClientId()).isEqualTo(501);
    }

    @Test
    void removingBoundaryRecomputesMinAndMax() {
        ServerItemList list = new ServerItemList();
        list.add(new ServerItem(100, 1));
        list.add(new ServerItem(150, 2));
        list.add(new ServerItem(200, 3));

        assertThat(list.removeById(200)).isTrue();
        assertThat(list.maxId()).isEqualTo(150);

        assertThat(list.removeById(100)).isTrue();
        assertThat(list.minId()).isEqualTo(150);
        assertThat(list.hasClientId(1)).isFalse();

        assertThat(list.removeById(999)).isFalse();
    }

    @Test
    void duplicateIdReplacesAndUnlinksClientId() {
        ServerItemList list = new ServerItemList();
        list.add(new ServerItem(100, 7));
        ServerItem replacement = new ServerItem(100, 8);
        list.add(replacement);

        assertThat(list.size()).isEqualTo(1);
        assertThat(list.hasClientId(7)).isFalse();
        assertThat(list.getFirstByClientId(8)).isSameAs(replacement);
    }

    @Test
    void toArrayIsSortedById() {
        ServerItemList list = new ServerItemList();
        list.add(new ServerItem(300, 1));
        list.add(new ServerItem(100, 2));
        list.add(new ServerItem(200, 3));

        assertThat(list.toArray()).extracting(ServerItem::id).containsExactly(100, 200, 300);
    }

    @Test
    void createMissingItemsFillsClientIdGap() {
        ServerItemList list = new ServerItemList();
        list.add(new ServerItem(100, 100));
        list.add(new ServerItem(101, 101));

        int created = list.createMissingItems(104);

        assertThat(created).isEqualTo(3);
        assertThat(list.getFirstByClientId(102).id()).isEqualTo(102);
        assertThat(list.getFirstByClientId(104).id()).isEqualTo(104);
        assertThat(list.getFirstByClientId(104).spriteHash()).isEqualTo(new byte[16]);
        assertThat(list.createMissingItems(104)).isZero();
    }
}
