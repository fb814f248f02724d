package github.sarthakdev143.signage_engine.integration.presentation;

import github.sarthakdev143.signage_engine.model.SceneItemTransform;
import github.sarthakdev143.signage_engine.model.SourceKind;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryPresentationControllerTest {

    private final InMemoryPresentationController controller = new InMemoryPresentationController();

    @Test
    void duplicateSceneIsRejected() throws PresentationException {
        controller.createScene("a.png_scene");

        assertThatThrownBy(() -> controller.createScene("a.png_scene"))
                .isInstanceOf(PresentationException.class);
    }

    @Test
    void sourceRequiresExistingScene() {
        assertThatThrownBy(() -> controller.createSource("missing", "a.png_source", SourceKind.IMAGE_SOURCE, Map.of()))
                .isInstanceOf(PresentationException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void sceneItemIdsResolveOnlyInsideTheirScene() throws PresentationException {
        controller.createScene("a.png_scene");
        controller.createScene("b.png_scene");
        controller.createSource("a.png_scene", "a.png_source", SourceKind.IMAGE_SOURCE, Map.of("file", "/a.png"));

        OptionalInt id = controller.getSourceItemId("a.png_scene", "a.png_source");

        assertThat(id).isPresent();
        assertThat(controller.getSourceItemId("b.png_scene", "a.png_source")).isEmpty();

        SceneItemTransform transform = SceneItemTransform.fitCanvas(1280, 720);
        controller.setSourceTransform("a.png_scene", id.getAsInt(), transform);
        assertThat(controller.transformOf("a.png_source")).contains(transform);
    }

    @Test
    void removingActiveSceneClearsProgramScene() throws PresentationException {
        controller.createScene("a.png_scene");
        controller.setActiveScene("a.png_scene");

        controller.removeScene("a.png_scene");

        assertThat(controller.activeScene()).isEmpty();
    }

    @Test
    void fitCanvasCentersWithScaleInnerBounds() {
        SceneItemTransform transform = SceneItemTransform.fitCanvas(1920, 1080);

        assertThat(transform.positionX()).isEqualTo(960.0);
        assertThat(transform.positionY()).isEqualTo(540.0);
        assertThat(transform.boundsType().apiValue()).isEqualTo("OBS_BOUNDS_SCALE_INNER");
        assertThat(transform.boundsWidth()).isEqualTo(1920.0);
        assertThat(transform.alignment()).isEqualTo(SceneItemTransform.ALIGN_CENTER);
    }
}
