package io.github.cyfko.sheetlogic.core.spi;

import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Registration, lookup and isolation of {@link FunctionRegistry} instances.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FunctionRegistry Tests")
class FunctionRegistryTest {

    @Mock
    private FunctionProvider provider;

    private FunctionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new FunctionRegistry();
    }

    private static FunctionDefinition constant(String name, double value) {
        return FunctionDefinition.of(name, FunctionSignature.exactly(0), args -> EvaluatedValue.number(value));
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Registers every function of a provider")
        void registersProvider() {
            when(provider.functions()).thenReturn(List.of(constant("ONE", 1), constant("TWO", 2)));

            registry.register(provider);

            assertEquals(Set.of("ONE", "TWO"), registry.names());
            verify(provider, atLeastOnce()).functions();
        }

        @Test
        @DisplayName("Names are stored upper-case and looked up case-insensitively")
        void caseInsensitive() {
            when(provider.functions()).thenReturn(List.of(constant("vat", 0.2)));

            registry.register(provider);

            assertTrue(registry.isRegistered("VAT"));
            assertTrue(registry.lookup(" Vat ").isPresent());
            assertEquals("VAT", registry.lookup("vat").orElseThrow().name());
        }

        @Test
        @DisplayName("A duplicate name fails without registering anything")
        void duplicateIsAtomic() {
            registry.register(() -> List.of(constant("ONE", 1)));
            when(provider.functions()).thenReturn(List.of(constant("TWO", 2), constant("ONE", 1)));

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.register(provider));

            assertTrue(e.getMessage().contains("ONE"));
            assertFalse(registry.isRegistered("TWO"));
        }

        @Test
        @DisplayName("A provider repeating a name is rejected")
        void duplicateInsideProvider() {
            when(provider.functions()).thenReturn(List.of(constant("X", 1), constant("x", 2)));

            assertThrows(IllegalArgumentException.class, () -> registry.register(provider));
            assertTrue(registry.names().isEmpty());
        }

        @Test
        void rejectsNullProvider() {
            assertThrows(NullPointerException.class, () -> registry.register(null));
        }
    }

    @Test
    @DisplayName("Unregistering frees the name")
    void unregister() {
        registry.register(() -> List.of(constant("ONE", 1)));

        registry.unregister(Set.of("one"));

        assertFalse(registry.isRegistered("ONE"));
        assertDoesNotThrow(() -> registry.register(() -> List.of(constant("ONE", 1))));
    }

    @Test
    @DisplayName("Builtin registries are independent instances")
    void builtinsAreIsolated() {
        FunctionRegistry first = FunctionRegistry.withBuiltins();
        FunctionRegistry second = FunctionRegistry.withBuiltins();

        first.register(() -> List.of(constant("CUSTOM", 1)));

        assertTrue(first.isRegistered("CUSTOM"));
        assertFalse(second.isRegistered("CUSTOM"));
        assertTrue(second.names().containsAll(Set.of("SUM", "VLOOKUP", "IF", "DATE", "PMT", "TEXT", "ROUND")));
    }

    @Test
    void blankLookup() {
        assertTrue(registry.lookup("").isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
    }

    @Test
    @DisplayName("Signatures validate their bounds")
    void signatures() {
        assertThrows(IllegalArgumentException.class, () -> FunctionSignature.between(3, 2));
        assertEquals("between 2 and 3", FunctionSignature.between(2, 3).describe());
        assertEquals("at least 1", FunctionSignature.atLeast(1).describe());
        assertTrue(FunctionSignature.atLeast(1).accepts(255));
        assertFalse(FunctionSignature.exactly(2).accepts(3));
        assertTrue(FunctionSignature.between(2, 3).emptyFrom(1).emptyAllowedAt(1));
    }
}
