package com.chatty.synth.config.seat;

import com.chatty.synth.config.properties.SeatProperties;
import com.chatty.synth.domain.HelperSeat;
import com.chatty.synth.exception.SeatConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeatConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsComeFromProperties() {
        SeatConfigurationLoader loader = new SeatConfigurationLoader(new SeatProperties(), new MockEnvironment());

        SeatModels models = loader.load();

        assertThat(models.modelFor(HelperSeat.CODING)).isEqualTo("deepseek-coder-v2");
        assertThat(models.modelFor(HelperSeat.CREATIVE)).isEqualTo("mistral:instruct");
        assertThat(models.modelFor(HelperSeat.SMALLTALK)).isEqualTo("phi3:latest");
        assertThat(models.synthesisModel()).isEqualTo("phi3:latest");
    }

    @Test
    void environmentOverridesSeatModel() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("OLLAMA_MODEL_CODING", "qwen2.5-coder")
                .withProperty("OLLAMA_MODEL_SYNTH", "llama3");
        SeatConfigurationLoader loader = new SeatConfigurationLoader(new SeatProperties(), env);

        SeatModels models = loader.load();

        assertThat(models.modelFor(HelperSeat.CODING)).isEqualTo("qwen2.5-coder");
        assertThat(models.modelFor(HelperSeat.CREATIVE)).isEqualTo("mistral:instruct");
        assertThat(models.synthesisModel()).isEqualTo("llama3");
    }

    @Test
    void fileEntriesMayBeTagsOrObjects() throws Exception {
        Path file = tempDir.resolve("models.json");
        Files.writeString(file, """
                {
                  "coding": "codellama",
                  "creative": {"tag": "mixtral", "role": "storyteller"}
                }
                """);
        SeatProperties props = new SeatProperties();
        props.setConfigFile(file.toString());

        SeatModels models = new SeatConfigurationLoader(props, new MockEnvironment()).load();

        assertThat(models.modelFor(HelperSeat.CODING)).isEqualTo("codellama");
        assertThat(models.modelFor(HelperSeat.CREATIVE)).isEqualTo("mixtral");
        assertThat(models.modelFor(HelperSeat.SMALLTALK)).isEqualTo("phi3:latest");
    }

    @Test
    void environmentBeatsFile() throws Exception {
        Path file = tempDir.resolve("models.json");
        Files.writeString(file, "{\"smalltalk\": \"gemma\"}");
        SeatProperties props = new SeatProperties();
        props.setConfigFile(file.toString());
        MockEnvironment env = new MockEnvironment().withProperty("OLLAMA_MODEL_SMALLTALK", "tinyllama");

        SeatModels models = new SeatConfigurationLoader(props, env).load();

        assertThat(models.modelFor(HelperSeat.SMALLTALK)).isEqualTo("tinyllama");
    }

    @Test
    void missingFileFails() {
        SeatProperties props = new SeatProperties();
        props.setConfigFile(tempDir.resolve("absent.json").toString());
        SeatConfigurationLoader loader = new SeatConfigurationLoader(props, new MockEnvironment());

        assertThatThrownBy(loader::load)
                .isInstanceOf(SeatConfigurationException.class)
                .hasMessageContaining("Cannot read seat configuration file");
    }

    @Test
    void malformedFileFails() throws Exception {
        Path file = tempDir.resolve("models.json");
        Files.writeString(file, "[\"not\", \"an object\"]");
        SeatProperties props = new SeatProperties();
        props.setConfigFile(file.toString());
        SeatConfigurationLoader loader = new SeatConfigurationLoader(props, new MockEnvironment());

        assertThatThrownBy(loader::load).isInstanceOf(SeatConfigurationException.class);
    }

    @Test
    void blankModelFails() throws Exception {
        Path file = tempDir.resolve("models.json");
        Files.writeString(file, "{\"creative\": {\"role\": \"no tag here\"}}");
        SeatProperties props = new SeatProperties();
        props.setConfigFile(file.toString());
        SeatConfigurationLoader loader = new SeatConfigurationLoader(props, new MockEnvironment());

        assertThatThrownBy(loader::load)
                .isInstanceOf(SeatConfigurationException.class)
                .hasMessageContaining("'creative'")
                .satisfies(e -> assertThat(((SeatConfigurationException) e).getSource()).isEqualTo(file.toString()));
    }

    @Test
    void missingPropertyModelFails() {
        SeatProperties props = new SeatProperties();
        props.getModels().remove("coding");

        assertThatThrownBy(() -> new SeatConfigurationLoader(props, new MockEnvironment()).load())
                .isInstanceOf(SeatConfigurationException.class)
                .hasMessageContaining("'coding'");
    }
}
