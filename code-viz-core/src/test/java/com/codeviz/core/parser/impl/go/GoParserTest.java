package com.codeviz.core.parser.impl.go;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GoParser}.
 */
class GoParserTest {

    private final GoParser parser = new GoParser();

    @Test
    void countFunctions_functionsMethodsAndLiterals() {
        String source = """
            package main

            func a() {}

            type S struct{}

            func (s S) m() {}

            func main() {
            	f := func() {}
            	f()
            }
            """;

        assertThat(parser.countFunctions(parser.parse(source))).isEqualTo(4);
    }

    @Test
    void findCommentRanges_lineAndBlockComments() {
        String source = """
            package main

            // Comment
            /* Block */
            func main() {}
            """;

        assertThat(parser.findCommentRanges(parser.parse(source))).hasSize(2);
    }

    @Test
    void getAliases_includesGolang() {
        assertThat(parser.getAliases()).containsExactly("golang");
    }
}
