package dtm.ioc.testing;

import dtm.ioc.core.DependencyScope;
import dtm.ioc.storage.DependencyScopeStorage;
import lombok.NonNull;

/**
 * Ponto de entrada para compor escopos de teste.
 *
 * <pre>
 *   DependencyScope scope = TestingScope.from(appScope)
 *           .overrideToken(DATABASE).useValue(mockDatabase)
 *           .compile();
 * </pre>
 */
public final class TestingScope {

    private TestingScope() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Inicia a composição de um escopo filho de {@code parent}. O pai nunca é alterado.
     */
    public static TestingScopeBuilder from(@NonNull DependencyScope parent) {
        return new TestingScopeBuilder(parent);
    }

    /**
     * Cria um escopo raiz vazio, para testes montados inteiramente à mão.
     */
    public static DependencyScope isolated() {
        return DependencyScopeStorage.newRootScope("test");
    }
}
