package dtm.ioc.core;

/**
 * Comportamento de {@code register} quando o token já possui registro no mesmo escopo.
 */
public enum DuplicateRegistrationPolicy {
    /** O último registro vence. */
    REPLACE,
    /** O segundo registro é rejeitado com {@code InvalidRegistrationException}. */
    REJECT
}
