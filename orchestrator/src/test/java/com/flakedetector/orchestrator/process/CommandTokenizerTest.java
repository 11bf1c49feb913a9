package com.flakedetector.orchestrator.process;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandTokenizerTest {

    @Test
    void tokenize_splitsOnWhitespace() {
        assertThat(CommandTokenizer.tokenize("  pytest   tests/test_flaky.py\t-q "))
                .containsExactly("pytest", "tests/test_flaky.py", "-q");
    }

    @Test
    void tokenize_singleQuotesAreLiteral() {
        assertThat(CommandTokenizer.tokenize("sh -c 'exit 1; echo $HOME \\n'"))
                .containsExactly("sh", "-c", "exit 1; echo $HOME \\n");
    }

    @Test
    void tokenize_doubleQuotesHonourBackslashEscapes() {
        assertThat(CommandTokenizer.tokenize("echo \"say \\\"hi\\\" to \\$USER\" done"))
                .containsExactly("echo", "say \"hi\" to $USER", "done");
    }

    @Test
    void tokenize_adjacentQuotedPartsJoinIntoOneArgument() {
        assertThat(CommandTokenizer.tokenize("--name='a b'\"c d\"e"))
                .containsExactly("--name=a bc de");
    }

    @Test
    void tokenize_emptyQuotesProduceEmptyArgument() {
        assertThat(CommandTokenizer.tokenize("cmd '' \"\""))
                .containsExactly("cmd", "", "");
    }

    @Test
    void tokenize_shellMetacharactersAreNotInterpreted() {
        assertThat(CommandTokenizer.tokenize("go test ./... | tee out.txt; rm -rf /"))
                .containsExactly("go", "test", "./...", "|", "tee", "out.txt;", "rm", "-rf", "/");
    }

    @Test
    void tokenize_backslashEscapesSpaceOutsideQuotes() {
        assertThat(CommandTokenizer.tokenize("cat my\\ file.txt"))
                .containsExactly("cat", "my file.txt");
    }

    @Test
    void tokenize_unterminatedQuotes_throw() {
        assertThatThrownBy(() -> CommandTokenizer.tokenize("echo 'oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("single quote");
        assertThatThrownBy(() -> CommandTokenizer.tokenize("echo \"oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("double quote");
        assertThatThrownBy(() -> CommandTokenizer.tokenize("echo oops\\"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("backslash");
    }
}
