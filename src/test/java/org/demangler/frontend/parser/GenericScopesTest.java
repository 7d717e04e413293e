package org.demangler.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link GenericScopes}.
 */
@Tag("unit")
class GenericScopesTest {

    /**
     * Verifies that references count scopes outward and that names keep counting across scopes.
     */
    @Test
    void resolve_shouldCountScopesOutward() {
        // Arrange
        GenericScopes scopes = new GenericScopes();
        scopes.enterScope();
        scopes.declareArchetype();
        scopes.declareArchetype();
        scopes.enterScope();
        scopes.declareArchetype();

        // Act & Assert
        assertThat(scopes.depth()).isEqualTo(2);
        assertThat(scopes.resolve(0, 0)).contains("C");
        assertThat(scopes.resolve(1, 0)).contains("A");
        assertThat(scopes.resolve(1, 1)).contains("B");
        assertThat(scopes.resolve(0, 1)).isEmpty();
        assertThat(scopes.resolve(2, 0)).isEmpty();
    }

    /**
     * Verifies that names declared after a scope closes do not reuse earlier names.
     */
    @Test
    void declareArchetype_shouldNotReuseNamesAfterLeavingScope() {
        // Arrange
        GenericScopes scopes = new GenericScopes();
        scopes.enterScope();
        scopes.declareArchetype();
        scopes.leaveScope();
        scopes.enterScope();

        // Act
        String name = scopes.declareArchetype();

        // Assert
        assertThat(name).isEqualTo("B");
        assertThat(scopes.resolve(0, 0)).contains("B");
    }

    /**
     * Verifies that using the scopes without an open scope is a programming error.
     */
    @Test
    void shouldRejectUseWithoutOpenScope() {
        // Arrange
        GenericScopes scopes = new GenericScopes();

        // Act & Assert
        assertThatThrownBy(scopes::declareArchetype).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(scopes::leaveScope).isInstanceOf(IllegalStateException.class);
        assertThat(scopes.resolve(0, 0)).isEmpty();
    }

    /**
     * Verifies that names run through the alphabet and then continue with a round number.
     */
    @Test
    void archetypeName_shouldWrapAfterAlphabet() {
        // Act & Assert
        assertThat(GenericScopes.archetypeName(0)).isEqualTo("A");
        assertThat(GenericScopes.archetypeName(25)).isEqualTo("Z");
        assertThat(GenericScopes.archetypeName(26)).isEqualTo("A1");
        assertThat(GenericScopes.archetypeName(27)).isEqualTo("B1");
        assertThat(GenericScopes.archetypeName(52)).isEqualTo("A2");
    }
}
