package dtm.ioc.sample;

import dtm.ioc.core.DependencyScopeRegistor;
import dtm.ioc.prototypes.Token;
import dtm.ioc.startup.ScopeModule;

public class SampleModule implements ScopeModule {

    public static final Token<Database> DATABASE = Token.named("database", Database.class);
    public static final Token<Repository> REPOSITORY = Token.of(Repository.class);
    public static final Token<Service> SERVICE = Token.of(Service.class);

    @Override
    public void configure(DependencyScopeRegistor registor) {
        registor.registerFactory(DATABASE, scope -> Databases.placeholderForRealDatabase());
        registor.registerClass(REPOSITORY, Repository.class, DATABASE);
        registor.registerClass(SERVICE, Service.class, REPOSITORY);
    }
}
