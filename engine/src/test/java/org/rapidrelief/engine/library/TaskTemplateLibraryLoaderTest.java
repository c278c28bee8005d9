package org.rapidrelief.engine.library;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rapidrelief.engine.config.ConfigurationLoader;
import org.rapidrelief.engine.config.EngineConfig;
import org.rapidrelief.engine.domain.exception.ConfigurationException;
import org.rapidrelief.engine.domain.model.TaskDependency;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class TaskTemplateLibraryLoaderTest {

    private final TaskTemplateLibraryLoader loader = new TaskTemplateLibraryLoader(new ConfigurationLoader());

    @Test
    @DisplayName("the bundled templates declare meta-tasks and scene chains")
    void loadsBundledTemplates() {
        TaskTemplateLibrary library = loader.load(EngineConfig.DEFAULT_TASK_TEMPLATES);

        assertThat(library.getMetaTasks()).containsKeys("EM01", "EM03", "EM06", "EM07", "EM08", "EM10", "EM11", "EM14");
        assertThat(library.getScenes()).containsOnlyKeys("EQ_COLLAPSE", "EQ_SECONDARY_FIRE", "HAZMAT_LEAK", "FLOOD");

        MetaTaskDefinition assessment = library.findMetaTask("EM03").orElseThrow(AssertionError::new);
        assertThat(assessment.getGoldenHourMinutes()).isEqualTo(45);
        assertThat(assessment.getDependencies()).extracting(TaskDependency::getTaskCode, TaskDependency::isStrict)
                .containsExactly(tuple("EM01", false));

        SceneTemplate fire = library.findScene("EQ_SECONDARY_FIRE").orElseThrow(AssertionError::new);
        assertThat(fire.getTasks()).containsExactly("EM01", "EM03", "EM07", "EM06");
        assertThat(fire.getParallelGroups()).containsExactly(Arrays.asList("EM03", "EM07"));
        assertThat(library.findScene("VOLCANO")).isEmpty();
    }

    @Test
    @DisplayName("plain dependency codes are strict")
    void plainDependenciesAreStrict() {
        MetaTaskDefinition extraction = loader.load(EngineConfig.DEFAULT_TASK_TEMPLATES)
                .findMetaTask("EM10").orElseThrow(AssertionError::new);

        assertThat(extraction.getDependencies()).hasSize(1);
        assertThat(extraction.getDependencies().get(0).isStrict()).isTrue();
    }

    @Test
    @DisplayName("a scene listing an undeclared task is rejected")
    void unknownTaskInScene(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("templates.yaml");
        Files.write(file, ("meta_tasks:\n"
                + "  EM01: {name: Recon, required_capabilities: [aerial_recon]}\n"
                + "scenes:\n"
                + "  QUAKE: {tasks: [EM01, EM99]}\n").getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> loader.load(file.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("EM99");
    }

    @Test
    @DisplayName("both sections are required")
    void sectionsRequired(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("templates.yaml");
        Files.write(file, "meta_tasks:\n  EM01: {name: Recon}\n".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> loader.load(file.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("scenes");
    }
}
