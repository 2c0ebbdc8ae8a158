package dtm.ioc.testing;

import dtm.ioc.core.DependencyScope;
import dtm.ioc.prototypes.Token;
import dtm.ioc.sample.Database;
import dtm.ioc.sample.Repository;
import dtm.ioc.sample.SampleModule;
import dtm.ioc.sample.Service;
import dtm.ioc.startup.ManagedScopeStartup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static dtm.ioc.sample.SampleModule.DATABASE;
import static dtm.ioc.sample.SampleModule.REPOSITORY;
import static dtm.ioc.sample.SampleModule.SERVICE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TestingScopeTest {

    private static DependencyScope appScope;

    @Mock
    private Database mockDatabase;

    @Mock
    private Repository mockRepository;

    private DependencyScope testScope;

    @BeforeEach
    void setUp() {
        if(appScope == null){
            appScope = ManagedScopeStartup.builder()
                    .module(new SampleModule())
                    .build()
                    .start();
        }
    }

    @AfterEach
    void tearDown() {
        if(testScope != null){
            testScope.close();
        }
    }

    @Test
    @DisplayName("Singletons are not instantiated more than once")
    void singletonsAreNotInstantiatedTwice() {
        Service service = appScope.resolve(SERVICE);
        Database database = appScope.resolve(DATABASE);
        Repository repository = appScope.resolve(REPOSITORY);

        assertThat(appScope.resolve(SERVICE)).isSameAs(service);
        assertThat(appScope.resolve(DATABASE)).isSameAs(database);
        assertThat(appScope.resolve(REPOSITORY)).isSameAs(repository);
        assertThat(service.getRepository()).isSameAs(repository);
        assertThat(repository.getDb()).isSameAs(database);
    }

    @Test
    @DisplayName("Real instances are used when nothing is overridden")
    void realInstancesWithoutMocks() {
        assertThat(appScope.resolve(SERVICE).get(1)).isEqualTo(Map.of("id", 1, "name", "test"));
    }

    @Test
    @DisplayName("The database can be replaced by a mock")
    void mockDatabase() {
        given(mockDatabase.query(anyString())).willReturn(List.of(Map.of("id", 2, "name", "mocked")));

        testScope = TestingScope.from(appScope)
                .overrideToken(DATABASE).useValue(mockDatabase)
                .compile();

        assertThat(testScope.resolve(SERVICE).get(1)).isEqualTo(Map.of("id", 2, "name", "mocked"));
        verify(mockDatabase).query("SELECT * FROM tableA WHERE id = 1");
        assertThat(appScope.resolve(SERVICE).get(1)).isEqualTo(Map.of("id", 1, "name", "test"));
    }

    @Test
    @DisplayName("The repository can be replaced by a mock")
    void mockRepository() {
        given(mockRepository.get(1)).willReturn(Map.of("id", 3, "name", "mocked"));

        testScope = TestingScope.from(appScope)
                .name("mock-repository")
                .overrideToken(Repository.class).useValue(mockRepository)
                .compile();

        assertThat(testScope.getName()).isEqualTo("mock-repository");
        assertThat(testScope.resolve(SERVICE).get(1)).isEqualTo(Map.of("id", 3, "name", "mocked"));
        assertThat(testScope.isResolved(DATABASE)).isFalse();
    }

    @Test
    @DisplayName("Overrides by factory and by class are wired through the test scope")
    void overrideByFactoryAndClass() {
        Token<Service> auditedService = Token.of(Service.class, "audited");

        testScope = TestingScope.from(appScope)
                .overrideToken(DATABASE).useFactory(scope -> queryString -> List.of(Map.of("id", 4, "name", "factory")))
                .overrideToken(auditedService).useClass(Service.class, REPOSITORY)
                .compile();

        assertThat(testScope.resolve(auditedService).get(1)).containsEntry("id", 4);
        assertThat(appScope.isRegistered(auditedService)).isFalse();
    }

    @Test
    @DisplayName("An isolated scope starts empty")
    void isolatedScope() {
        testScope = TestingScope.isolated();
        testScope.registerConstant(DATABASE, mockDatabase);

        assertThat(testScope.getParent()).isNull();
        assertThat(testScope.isRegistered(SERVICE)).isFalse();
        assertThat(testScope.resolve(DATABASE)).isSameAs(mockDatabase);
    }
}
