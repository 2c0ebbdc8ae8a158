package dtm.ioc.startup;

import dtm.ioc.core.DependencyScope;
import dtm.ioc.core.ScopeConfigurations;
import dtm.ioc.prototypes.Token;
import dtm.ioc.storage.DependencyScopeStorage;
import dtm.ioc.storage.ScopeConfigurationsStorage;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Inicialização de um escopo raiz: cria o escopo, aplica os módulos e resolve os pontos de entrada.
 *
 * <pre>
 *   DependencyScope root = ManagedScopeStartup.builder()
 *           .module(new PersistenceModule())
 *           .entryPoint(Token.of(Service.class))
 *           .start();
 * </pre>
 *
 * O escopo devolvido é responsabilidade de quem chamou; nenhuma referência global é mantida.
 */
public class ManagedScopeStartup {
    private static final Logger logger = LoggerFactory.getLogger(ManagedScopeStartup.class);

    private final String name;
    private final ScopeConfigurations configurations;
    private final List<ScopeModule> modules;
    private final List<Token<?>> entryPoints;

    private ManagedScopeStartup(Builder builder) {
        this.name = builder.name;
        this.configurations = builder.configurations;
        this.modules = List.copyOf(builder.modules);
        this.entryPoints = List.copyOf(builder.entryPoints);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Token<?>> getEntryPoints() {
        return entryPoints;
    }

    public DependencyScope start() {
        final long start = System.nanoTime();
        logger.info("Iniciando escopo '{}' ({} módulo(s), {} ponto(s) de entrada)", name, modules.size(), entryPoints.size());

        DependencyScope scope = DependencyScopeStorage.newRootScope(name, configurations);
        try{
            for (ScopeModule module : modules) {
                logger.debug("Aplicando módulo {}", module.getClass().getName());
                module.configure(scope);
            }
            for (Token<?> entryPoint : entryPoints) {
                Object instance = scope.resolve(entryPoint);
                logger.debug("Ponto de entrada {} resolvido: {}", entryPoint, instance.getClass().getName());
            }
        }catch (RuntimeException e){
            logger.error("Falha ao iniciar o escopo '{}': {}", name, e.getMessage(), e);
            closeQuietly(scope, e);
            throw e;
        }

        logger.info("Escopo '{}' iniciado em {} ms", name, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return scope;
    }

    private void closeQuietly(DependencyScope scope, RuntimeException cause) {
        try{
            scope.close();
        }catch (RuntimeException closeError){
            cause.addSuppressed(closeError);
        }
    }

    public static final class Builder {
        private String name = "application";
        private ScopeConfigurations configurations = new ScopeConfigurationsStorage();
        private final List<ScopeModule> modules = new ArrayList<>();
        private final List<Token<?>> entryPoints = new ArrayList<>();

        private Builder() {
        }

        public Builder name(@NonNull String name) {
            this.name = name;
            return this;
        }

        public Builder configurations(@NonNull ScopeConfigurations configurations) {
            this.configurations = configurations;
            return this;
        }

        public Builder module(@NonNull ScopeModule module) {
            this.modules.add(module);
            return this;
        }

        public Builder entryPoint(@NonNull Token<?> token) {
            this.entryPoints.add(token);
            return this;
        }

        public Builder entryPoint(@NonNull Class<?> type) {
            return entryPoint(Token.of(type));
        }

        public ManagedScopeStartup build() {
            return new ManagedScopeStartup(this);
        }

        public DependencyScope start() {
            return build().start();
        }
    }
}
