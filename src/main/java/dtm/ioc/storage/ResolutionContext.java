package dtm.ioc.storage;

import dtm.ioc.exceptions.CircularDependencyException;
import dtm.ioc.prototypes.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Conjunto de tokens em construção durante uma chamada de resolução (e suas recursões).
 */
final class ResolutionContext {
    private final List<Token<?>> path = new ArrayList<>();
    private final Set<Token<?>> underConstruction = new HashSet<>();

    void enter(Token<?> token) {
        if(!underConstruction.add(token)){
            List<Token<?>> cycle = new ArrayList<>(path.subList(path.indexOf(token), path.size()));
            cycle.add(token);
            throw new CircularDependencyException(cycle);
        }
        path.add(token);
    }

    void exit(Token<?> token) {
        underConstruction.remove(token);
        path.remove(path.size() - 1);
    }

    int depth() {
        return path.size();
    }
}
