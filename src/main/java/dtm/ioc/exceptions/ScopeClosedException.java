package dtm.ioc.exceptions;

public class ScopeClosedException extends DependencyContainerException {
    public ScopeClosedException(String scopeName) {
        super("Escopo encerrado: " + scopeName);
    }
}
