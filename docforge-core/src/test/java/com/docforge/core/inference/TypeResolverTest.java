package com.docforge.core.inference;

import com.docforge.core.model.InferredType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TypeResolver}.
 */
class TypeResolverTest {

    private final TypeResolver resolver = new TypeResolver();

    @Test
    void resolve_noEvidence_returnsUnknown() {
        assertThat(resolver.resolve(Set.of())).isEqualTo(InferredType.UNKNOWN);
    }

    @Test
    void resolve_attributeAccessOnly_returnsUnknown() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.ATTRIBUTE)).known()).isFalse();
    }

    @Test
    void resolve_arithmetic_returnsNumber() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.ARITHMETIC, EvidenceTag.NUMERIC_COMPARISON)))
            .isEqualTo(InferredType.of("int | float"));
    }

    @Test
    void resolve_stringMethodWithIteration_returnsStr() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.STRING_METHOD, EvidenceTag.ITERATED, EvidenceTag.ATTRIBUTE)))
            .isEqualTo(InferredType.of("str"));
    }

    @Test
    void resolve_mutationAndIndexing_returnsList() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.SEQUENCE_MUTATION, EvidenceTag.INDEXED)))
            .isEqualTo(InferredType.of("list"));
    }

    @Test
    void resolve_keyAccess_returnsMapping() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.KEY_ACCESS, EvidenceTag.ITERATED)))
            .isEqualTo(InferredType.of("Mapping"));
    }

    @Test
    void resolve_iterationOnly_returnsIterable() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.ITERATED))).isEqualTo(InferredType.of("Iterable"));
    }

    @Test
    void resolve_sizedAndIterated_returnsCollection() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.SIZED, EvidenceTag.ITERATED)))
            .isEqualTo(InferredType.of("Collection"));
    }

    @Test
    void resolve_called_returnsCallable() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.CALLED))).isEqualTo(InferredType.of("Callable"));
    }

    @Test
    void resolve_conflictingEvidence_returnsUnknown() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.STRING_METHOD, EvidenceTag.ARITHMETIC)))
            .isEqualTo(InferredType.UNKNOWN);
    }

    @Test
    void resolve_boolDefault_returnsBool() {
        assertThat(resolver.resolve(EnumSet.of(EvidenceTag.BOOL_DEFAULT))).isEqualTo(InferredType.of("bool"));
    }
}
