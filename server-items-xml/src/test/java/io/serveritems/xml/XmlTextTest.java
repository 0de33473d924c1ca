package io.serveritems.xml;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class XmlTextTest {

    @Test
    void escapesMarkupCharacters() {
        assertThat(XmlText.escape("Tom & \"Jerry\" <3 >")).isEqualTo("Tom &amp; &quot;Jerry&quot; &lt;3 &gt;");
    }

    @Test
    void leavesPlainTextAndApostrophes() {
        assertThat(XmlText.escape("knight's sword")).isEqualTo("knight's sword");
        assertThat(XmlText.escape(null)).isEmpty();
    }
}
