// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class RegistryExceptionTest {

    @ParameterizedTest
    @EnumSource(RegistryError.class)
    void factoryPicksSubclassByCategory(RegistryError error) {
        RegistryException ex = RegistryException.of(error, "detail");

        assertSame(error, ex.error());
        assertSame(error.category(), ex.category());
        assertTrue(ex.getMessage().startsWith(error.name() + ": "));
        assertInstanceOf(CovenantException.class, ex);

        Class<? extends RegistryException> expected;
        switch (error.category()) {
            case AUTHORIZATION:
                expected = UnauthorizedException.class;
                break;
            case NOT_FOUND:
                expected = NotFoundException.class;
                break;
            case CONFLICT:
                expected = ConflictException.class;
                break;
            case VALIDATION:
                expected = InvalidInputException.class;
                break;
            default:
                expected = ExpiredException.class;
                break;
        }
        assertEquals(expected, ex.getClass());
    }

    @Test
    void categoriesFollowTaxonomy() {
        assertEquals(ErrorCategory.AUTHORIZATION, RegistryError.UNAUTHORIZED_FEEDBACK.category());
        assertEquals(ErrorCategory.NOT_FOUND, RegistryError.DID_NOT_REGISTERED.category());
        assertEquals(ErrorCategory.CONFLICT, RegistryError.VALIDATION_ALREADY_RESPONDED.category());
        assertEquals(ErrorCategory.VALIDATION, RegistryError.SIGNATURE_EXPIRED.category());
        assertEquals(ErrorCategory.TEMPORAL, RegistryError.REQUEST_EXPIRED.category());
    }

    @Test
    void causeIsPreserved() {
        IllegalArgumentException cause = new IllegalArgumentException("bad curve point");
        RegistryException ex = RegistryException.of(RegistryError.INVALID_AGENT_SIGNATURE, "recovery failed", cause);
        assertSame(cause, ex.getCause());
    }

    @Test
    void eip712FactoriesDescribeProblem() {
        assertTrue(Eip712Exception.missingField("Mail", "to").getMessage().contains("'to'"));
        assertTrue(Eip712Exception.unknownType("Foo").getMessage().contains("Foo"));
        assertInstanceOf(CovenantException.class, Eip712Exception.cyclicDependency("Node"));
    }
}
