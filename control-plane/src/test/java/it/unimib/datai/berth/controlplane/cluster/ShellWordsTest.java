package it.unimib.datai.berth.controlplane.cluster;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShellWordsTest {

    @Test
    void split_handlesQuotesAndEscapes() {
        assertThat(ShellWords.split("sh -c 'echo \"hi there\"' a\\ b \"x\\\"y\""))
                .containsExactly("sh", "-c", "echo \"hi there\"", "a b", "x\"y");
    }

    @Test
    void split_collapsesWhitespaceAndKeepsEmptyQuotedWord() {
        assertThat(ShellWords.split("  npm   run  start ''")).containsExactly("npm", "run", "start", "");
    }

    @Test
    void split_nullOrBlank_returnsEmpty() {
        assertThat(ShellWords.split(null)).isEmpty();
        assertThat(ShellWords.split("   ")).isEmpty();
    }

    @Test
    void split_unbalancedQuote_throws() {
        assertThatThrownBy(() -> ShellWords.split("echo 'oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unbalanced quote");
    }
}
