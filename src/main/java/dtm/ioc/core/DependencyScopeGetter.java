package dtm.ioc.core;

import dtm.ioc.exceptions.CircularDependencyException;
import dtm.ioc.exceptions.UnregisteredTokenException;
import dtm.ioc.prototypes.Dependency;
import dtm.ioc.prototypes.LazyDependency;
import dtm.ioc.prototypes.Token;

import java.util.List;
import java.util.Optional;

/**
 * Interface responsável por fornecer acesso às dependências registradas no escopo.
 *
 * Toda resolução parte do escopo que recebeu a chamada (escopo de origem): o cache consultado,
 * os overrides aplicados e o cache preenchido são sempre os desse escopo, mesmo quando o registro
 * foi encontrado em um escopo ancestral.
 */
public interface DependencyScopeGetter {
    /**
     * Obtém a instância associada ao token.
     *
     * @param <T>   tipo da dependência esperada
     * @param token token da dependência
     * @return instância da dependência
     * @throws UnregisteredTokenException  se nenhum escopo da cadeia possui registro para o token
     * @throws CircularDependencyException se o token depende transitivamente de si mesmo
     */
    <T> T resolve(Token<T> token);

    /**
     * Atalho para {@code resolve(Token.of(reference))}.
     */
    <T> T resolve(Class<T> reference);

    /**
     * Atalho para {@code resolve(Token.of(reference, qualifier))}.
     */
    <T> T resolve(Class<T> reference, String qualifier);

    /**
     * Igual a {@link #resolve(Token)}, mas devolve vazio quando o token não está registrado.
     * Demais falhas continuam sendo propagadas.
     */
    <T> Optional<T> tryResolve(Token<T> token);

    /**
     * Cria um handle que resolve o token neste escopo somente na primeira chamada a
     * {@link LazyDependency#get()}.
     */
    <T> LazyDependency<T> lazy(Token<T> token);

    /**
     * Indica se o token possui registro neste escopo ou em algum ancestral.
     */
    boolean isRegistered(Token<?> token);

    /**
     * Indica se existe instância em cache para o token neste escopo (ancestrais não são consultados).
     */
    boolean isResolved(Token<?> token);

    /**
     * Retorna as dependências registradas localmente neste escopo.
     *
     * @return lista com as dependências registradas
     */
    List<Dependency> getRegisteredDependencies();
}
