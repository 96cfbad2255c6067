package io.github.cyfko.truthtable.core.config;

import io.github.cyfko.truthtable.core.api.Operator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class OperatorAliasesTest {

    @Test
    @DisplayName("Symbols and names are both registered")
    void shouldRegisterSymbolsAndNames() {
        assertEquals(10, OperatorAliases.asMap().size());
        assertEquals(Operator.IFF, OperatorAliases.asMap().get("<->"));
        assertEquals(Operator.IFF, OperatorAliases.asMap().get("iff"));
        assertThrows(UnsupportedOperationException.class, () -> OperatorAliases.asMap().put("&", Operator.AND));
    }

    @Test
    @DisplayName("Lookup ignores case and surrounding blanks")
    void shouldLookupIgnoringCase() {
        assertEquals(Optional.of(Operator.IMPLIES), OperatorAliases.lookup(" IMPLIES "));
        assertEquals(Optional.of(Operator.OR), OperatorAliases.lookup("Or"));
        assertEquals(Optional.empty(), OperatorAliases.lookup("<-"));
    }

    @Test
    @DisplayName("Alternation prefers the longest alias")
    void shouldMatchLongestAliasFirst() {
        Pattern pattern = Pattern.compile(OperatorAliases.ALTERNATION, Pattern.CASE_INSENSITIVE);

        Matcher iff = pattern.matcher("<->");
        assertTrue(iff.lookingAt());
        assertEquals("<->", iff.group());

        Matcher implies = pattern.matcher("IMPLIES");
        assertTrue(implies.lookingAt());
        assertEquals("IMPLIES", implies.group());
    }
}
