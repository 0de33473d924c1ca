package io.serveritems.sync;

import io.serveritems.core.ServerItemsException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObdPropertyFlagTest {

    @Test
    void resolvesKnownCodes() {
        assertThat(ObdPropertyFlag.fromCode(0x00)).isEqualTo(ObdPropertyFlag.GROUND);
        assertThat(ObdPropertyFlag.fromCode(0x0D)).isEqualTo(ObdPropertyFlag.UNMOVEABLE);
        assertThat(ObdPropertyFlag.fromCode(0x1E)).isEqualTo(ObdPropertyFlag.LENS_HELP);
        assertThat(ObdPropertyFlag.fromCode(0x26)).isEqualTo(ObdPropertyFlag.TOP_EFFECT);
        assertThat(ObdPropertyFlag.fromCode(0xFC)).isEqualTo(ObdPropertyFlag.HAS_CHARGES);
        assertThat(ObdPropertyFlag.fromCode(0xFF)).isEqualTo(ObdPropertyFlag.LAST_FLAG);
    }

    @Test
    void codesAreUnique() {
        for (ObdPropertyFlag flag : ObdPropertyFlag.values()) {
            assertThat(ObdPropertyFlag.fromCode(flag.code())).isSameAs(flag);
        }
    }

    @Test
    void rejectsUndefinedCodes() {
        assertThatThrownBy(() -> ObdPropertyFlag.fromCode(0x27))
                .isInstanceOf(ServerItemsException.UnknownPropertyFlag.class)
                .hasMessageContaining("0x27");
        assertThatThrownBy(() -> ObdPropertyFlag.fromCode(0x100))
                .isInstanceOf(ServerItemsException.UnknownPropertyFlag.class);
        assertThatThrownBy(() -> ObdPropertyFlag.fromCode(-1))
                .isInstanceOf(ServerItemsException.UnknownPropertyFlag.class);
    }
}
