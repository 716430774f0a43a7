package club.ppmc.runner.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ShellQuotingTest {

    @Test
    void shouldWrapInSingleQuotes() {
        assertEquals("'user_code.py'", ShellQuoting.quote("user_code.py"));
        assertEquals("'a b$c'", ShellQuoting.quote("a b$c"));
    }

    @Test
    void shouldEscapeEmbeddedQuote() {
        assertEquals("'it'\"'\"'s'", ShellQuoting.quote("it's"));
    }

    @Test
    void shouldQuoteEmptyString() {
        assertEquals("''", ShellQuoting.quote(""));
    }
}
