package hierfed.common.abe;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyTest {

    @Test
    void andBindsTighterThanOr() {
        AccessPolicy p = AccessPolicy.parse("a OR b AND c");
        assertTrue(p.isSatisfiedBy(List.of("a")));
        assertTrue(p.isSatisfiedBy(List.of("b", "c")));
        assertFalse(p.isSatisfiedBy(List.of("b")));
    }

    @Test
    void parenthesesAndQuotedAttributes() {
        AccessPolicy p = AccessPolicy.parse("facility AND (\"region:X\" OR region:Y)");
        assertTrue(p.isSatisfiedBy(List.of("facility", "region:Y")));
        assertFalse(p.isSatisfiedBy(List.of("region:X", "region:Y")));
        assertEquals(Set.of("facility", "region:X", "region:Y"), p.attributes());
    }

    @Test
    void clausesAreTheDisjunctiveNormalForm() {
        List<Set<String>> clauses = AccessPolicy.parse("facility AND (region:X OR region:Y)").clauses();
        assertEquals(List.of(Set.of("facility", "region:X"), Set.of("facility", "region:Y")), clauses);
        assertEquals(1, AccessPolicy.parse("a OR a").clauses().size(), "duplicate clauses collapse");
    }

    @Test
    void keywordsAreCaseInsensitive() {
        assertTrue(AccessPolicy.parse("a and b").isSatisfiedBy(List.of("a", "b")));
    }

    @Test
    void malformedPoliciesAreRejected() {
        for (String bad : new String[]{"", "a AND", "(a OR b", "a b", "AND a", "a )", "\"unterminated"}) {
            assertThrows(IllegalArgumentException.class, () -> AccessPolicy.parse(bad), "policy '" + bad + "'");
        }
    }
}
