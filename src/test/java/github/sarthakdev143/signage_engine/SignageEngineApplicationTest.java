package github.sarthakdev143.signage_engine;

import github.sarthakdev143.signage_engine.integration.presentation.InMemoryPresentationController;
import github.sarthakdev143.signage_engine.integration.presentation.PresentationController;
import github.sarthakdev143.signage_engine.integration.sync.MountedShareSyncProvider;
import github.sarthakdev143.signage_engine.service.ContentRefreshService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "signage.preflight.enabled=false",
        "signage.startup.enabled=false",
        "logging.file.name="
})
class SignageEngineApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextStartsWithDryRunController() {
        assertThat(context.getBean(PresentationController.class)).isInstanceOf(InMemoryPresentationController.class);
        assertThat(context.getBean(ContentRefreshService.class).currentSnapshot().managedState().isEmpty()).isTrue();
        assertThat(context.getBeanNamesForType(MountedShareSyncProvider.class)).isEmpty();
    }
}
