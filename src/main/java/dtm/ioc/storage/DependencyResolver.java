package dtm.ioc.storage;

import dtm.ioc.exceptions.InvalidRegistrationException;
import dtm.ioc.exceptions.NewInstanceException;
import dtm.ioc.prototypes.Registration;
import dtm.ioc.prototypes.Strategy;
import dtm.ioc.prototypes.Token;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Transforma um token em instância dentro de um escopo de origem.
 * <p>
 * Ordem: cache do escopo de origem, registro na cadeia de escopos, dependências declaradas
 * (resolvidas sempre pelo escopo de origem), construção e, para ciclos de vida com cache,
 * armazenamento no escopo de origem. A construção de um mesmo token é serializada por escopo.
 */
@Slf4j
final class DependencyResolver {

    private final DependencyScopeStorage scope;
    private final ThreadLocal<ResolutionContext> activeContext;

    DependencyResolver(DependencyScopeStorage scope) {
        this.scope = scope;
        this.activeContext = new ThreadLocal<>();
    }

    <T> T resolve(Token<T> token) {
        ResolutionContext context = activeContext.get();
        if(context != null){
            return resolve(token, context);
        }

        context = new ResolutionContext();
        activeContext.set(context);
        try{
            return resolve(token, context);
        }finally {
            activeContext.remove();
        }
    }

    private <T> T resolve(Token<T> token, ResolutionContext context) {
        Object cached = scope.getCachedInstance(token);
        if(cached != null){
            log.trace("[{}] cache: {}", scope.getName(), token);
            return checkedCast(token, cached);
        }

        Registration<T> registration = scope.lookupRegistration(token);

        context.enter(token);
        try{
            if(!isCacheable(registration)){
                return construct(token, registration, context);
            }

            ReentrantLock lock = scope.getConstructionLock(token);
            lock.lock();
            try{
                cached = scope.getCachedInstance(token);
                if(cached != null){
                    return checkedCast(token, cached);
                }

                // um override pode ter trocado o registro enquanto esperávamos o lock
                registration = scope.lookupRegistration(token);
                T instance = construct(token, registration, context);
                if(isCacheable(registration)){
                    scope.storeInstance(token, instance, !registration.getStrategy().isConstant());
                }
                return instance;
            }finally {
                lock.unlock();
            }
        }finally {
            context.exit(token);
        }
    }

    private boolean isCacheable(Registration<?> registration) {
        return registration.getLifecycle().isCached() || registration.getStrategy().isConstant();
    }

    /**
     * Tokens nomeados comparam apenas pelo nome; o tipo esperado por quem resolve pode divergir
     * do tipo registrado.
     */
    private <T> T checkedCast(Token<T> token, Object instance) {
        if(!token.getType().isInstance(instance)){
            throw new InvalidRegistrationException(
                    "Instância do tipo "+instance.getClass().getName()+" registrada para "+token
                            +" não é compatível com o tipo esperado "+token.getType().getName(),
                    token
            );
        }
        return token.cast(instance);
    }

    private <T> T construct(Token<T> token, Registration<T> registration, ResolutionContext context) {
        final Strategy<? extends T> strategy = registration.getStrategy();
        final long start = System.nanoTime();

        List<Token<?>> dependencyTokens = strategy.getDependencies();
        Object[] dependencies = new Object[dependencyTokens.size()];
        for (int i = 0; i < dependencies.length; i++) {
            dependencies[i] = resolve(dependencyTokens.get(i), context);
        }

        Object instance = strategy.instantiate(dependencies, scope);
        if(instance == null){
            throw new NewInstanceException("A estratégia "+strategy+" retornou null para "+token, token.getType());
        }

        if(log.isDebugEnabled()){
            log.debug("[{}] {} construído ({}, {}, profundidade {}) em {} µs",
                    scope.getName(),
                    token,
                    registration.getLifecycle(),
                    strategy,
                    context.depth(),
                    TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start));
        }
        return checkedCast(token, instance);
    }
}
