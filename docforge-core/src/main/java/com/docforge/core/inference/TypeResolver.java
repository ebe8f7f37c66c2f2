package com.docforge.core.inference;

import com.docforge.core.model.InferredType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.docforge.core.inference.EvidenceTag.ARITHMETIC;
import static com.docforge.core.inference.EvidenceTag.ATTRIBUTE;
import static com.docforge.core.inference.EvidenceTag.BOOL_DEFAULT;
import static com.docforge.core.inference.EvidenceTag.CALLED;
import static com.docforge.core.inference.EvidenceTag.DICT_DEFAULT;
import static com.docforge.core.inference.EvidenceTag.INDEXED;
import static com.docforge.core.inference.EvidenceTag.ITERATED;
import static com.docforge.core.inference.EvidenceTag.KEY_ACCESS;
import static com.docforge.core.inference.EvidenceTag.LIST_DEFAULT;
import static com.docforge.core.inference.EvidenceTag.MAPPING_METHOD;
import static com.docforge.core.inference.EvidenceTag.MEMBERSHIP;
import static com.docforge.core.inference.EvidenceTag.NUMERIC_COMPARISON;
import static com.docforge.core.inference.EvidenceTag.NUMERIC_DEFAULT;
import static com.docforge.core.inference.EvidenceTag.SEQUENCE_MUTATION;
import static com.docforge.core.inference.EvidenceTag.SET_METHOD;
import static com.docforge.core.inference.EvidenceTag.SIZED;
import static com.docforge.core.inference.EvidenceTag.STRING_DEFAULT;
import static com.docforge.core.inference.EvidenceTag.STRING_METHOD;
import static com.docforge.core.inference.EvidenceTag.STRING_OPERAND;

/**
 * Resolves a set of evidence tags to a single type through a fixed priority table.
 *
 * <p>Rows are ordered most specific first. A row matches when every observed tag is in its
 * allowed set and at least one observed tag is in its defining set. The first matching row
 * wins; no match means the evidence is absent or conflicting and yields
 * {@link InferredType#UNKNOWN}.
 */
public class TypeResolver {

    private record Rule(String type, Set<EvidenceTag> defining, Set<EvidenceTag> allowed) {
        boolean matches(Set<EvidenceTag> observed) {
            return allowed.containsAll(observed) && !Collections.disjoint(defining, observed);
        }
    }

    private static final List<Rule> RULES = List.of(
        new Rule("bool",
            EnumSet.of(BOOL_DEFAULT),
            EnumSet.of(BOOL_DEFAULT)),
        new Rule("str",
            EnumSet.of(STRING_METHOD, STRING_OPERAND, STRING_DEFAULT),
            EnumSet.of(STRING_METHOD, STRING_OPERAND, STRING_DEFAULT, INDEXED, ITERATED, MEMBERSHIP, SIZED)),
        new Rule("list",
            EnumSet.of(SEQUENCE_MUTATION, LIST_DEFAULT),
            EnumSet.of(SEQUENCE_MUTATION, LIST_DEFAULT, INDEXED, ITERATED, MEMBERSHIP, SIZED)),
        new Rule("dict",
            EnumSet.of(MAPPING_METHOD, DICT_DEFAULT),
            EnumSet.of(MAPPING_METHOD, DICT_DEFAULT, KEY_ACCESS, INDEXED, ITERATED, MEMBERSHIP, SIZED)),
        new Rule("set",
            EnumSet.of(SET_METHOD),
            EnumSet.of(SET_METHOD, ITERATED, MEMBERSHIP, SIZED)),
        new Rule("int | float",
            EnumSet.of(ARITHMETIC, NUMERIC_COMPARISON, NUMERIC_DEFAULT),
            EnumSet.of(ARITHMETIC, NUMERIC_COMPARISON, NUMERIC_DEFAULT)),
        new Rule("Mapping",
            EnumSet.of(KEY_ACCESS),
            EnumSet.of(KEY_ACCESS, INDEXED, ITERATED, MEMBERSHIP, SIZED)),
        new Rule("Sequence",
            EnumSet.of(INDEXED),
            EnumSet.of(INDEXED, ITERATED, MEMBERSHIP, SIZED)),
        new Rule("Container",
            EnumSet.of(MEMBERSHIP),
            EnumSet.of(MEMBERSHIP)),
        new Rule("Collection",
            EnumSet.of(SIZED, MEMBERSHIP),
            EnumSet.of(SIZED, ITERATED, MEMBERSHIP)),
        new Rule("Iterable",
            EnumSet.of(ITERATED),
            EnumSet.of(ITERATED)),
        new Rule("Callable",
            EnumSet.of(CALLED),
            EnumSet.of(CALLED))
    );

    /**
     * Resolves observed evidence.
     *
     * @param observed tags collected for one parameter
     * @return most specific consistent type, or {@link InferredType#UNKNOWN}
     */
    public InferredType resolve(Set<EvidenceTag> observed) {
        Set<EvidenceTag> decisive = observed.isEmpty() ? EnumSet.noneOf(EvidenceTag.class) : EnumSet.copyOf(observed);
        decisive.remove(ATTRIBUTE);
        if (decisive.isEmpty()) {
            return InferredType.UNKNOWN;
        }
        for (Rule rule : RULES) {
            if (rule.matches(decisive)) {
                return InferredType.of(rule.type());
            }
        }
        return InferredType.UNKNOWN;
    }
}
