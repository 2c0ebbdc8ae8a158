package dtm.ioc.prototypes;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Identificador imutável de uma dependência dentro do contêiner.
 * <p>
 * Existem duas formas de token:
 * <ul>
 *     <li><b>por tipo</b>: identificado pela classe e, opcionalmente, por uma qualificadora
 *     ({@link #of(Class)}, {@link #of(Class, String)});</li>
 *     <li><b>nomeado</b>: identificado apenas por uma chave textual opaca
 *     ({@link #named(String)}, {@link #named(String, Class)}). O tipo informado em
 *     {@link #named(String, Class)} serve apenas para o cast do resultado e não participa da igualdade.</li>
 * </ul>
 *
 * @param <T> tipo da instância resolvida para este token
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Token<T> {

    @EqualsAndHashCode.Include
    private final Class<?> identityType;

    @EqualsAndHashCode.Include
    private final String qualifier;

    @EqualsAndHashCode.Include
    private final String name;

    private final Class<T> type;

    private Token(Class<?> identityType, String qualifier, String name, Class<T> type) {
        this.identityType = identityType;
        this.qualifier = qualifier;
        this.name = name;
        this.type = type;
    }

    public static <T> Token<T> of(@NonNull Class<T> type) {
        return new Token<>(checkReferenceType(type), null, null, type);
    }

    public static <T> Token<T> of(@NonNull Class<T> type, String qualifier) {
        String normalized = normalize(qualifier);
        return new Token<>(checkReferenceType(type), normalized, null, type);
    }

    public static Token<Object> named(String name) {
        return named(name, Object.class);
    }

    public static <T> Token<T> named(String name, @NonNull Class<T> type) {
        String normalized = normalize(name);
        if(normalized == null){
            throw new IllegalArgumentException("O nome do token não pode ser vazio");
        }
        return new Token<>(null, null, normalized, checkReferenceType(type));
    }

    public boolean isNamed() {
        return name != null;
    }

    public T cast(Object instance) {
        return type.cast(instance);
    }

    @Override
    public String toString() {
        if(isNamed()){
            return "'" + name + "'";
        }
        return (qualifier == null)
                ? identityType.getSimpleName()
                : identityType.getSimpleName() + "@" + qualifier;
    }

    private static <C> Class<C> checkReferenceType(Class<C> type) {
        if(type.isPrimitive()){
            throw new IllegalArgumentException("Tipos primitivos não podem ser usados como token: " + type.getName());
        }
        return type;
    }

    private static String normalize(String value) {
        if(value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
