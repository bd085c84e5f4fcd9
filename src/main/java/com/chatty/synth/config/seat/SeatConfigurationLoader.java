package com.chatty.synth.config.seat;

import com.chatty.synth.config.properties.SeatProperties;
import com.chatty.synth.domain.HelperSeat;
import com.chatty.synth.domain.Seats;
import com.chatty.synth.exception.SeatConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the model tag for every helper seat and for synthesis.
 *
 * <p>Precedence, highest first:
 * <ol>
 *   <li>{@code OLLAMA_MODEL_<SEAT>} (e.g. {@code OLLAMA_MODEL_CODING}, {@code OLLAMA_MODEL_SYNTH})</li>
 *   <li>the JSON file named by {@code synth.seats.config-file}; entries are either a tag string
 *       or an object with a {@code tag} field</li>
 *   <li>{@code synth.seats.models.*} and {@code synth.seats.synthesis-model}</li>
 * </ol>
 *
 * <p>The file is re-read on every {@link #load()} so edits apply without a restart.
 */
@Component
public class SeatConfigurationLoader {

    private static final Logger LOG = LogManager.getLogger(SeatConfigurationLoader.class);
    static final String ENV_PREFIX = "OLLAMA_MODEL_";

    private final SeatProperties props;
    private final Environment environment;

    public SeatConfigurationLoader(SeatProperties props, Environment environment) {
        this.props = Objects.requireNonNull(props, "props");
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * @return complete seat model table
     * @throws SeatConfigurationException if the file cannot be read or parsed, or a seat has no model
     */
    public SeatModels load() {
        JSONObject file = readConfigFile();
        String source = file == null ? "synth.seats" : props.getConfigFile();

        Map<HelperSeat, String> models = new EnumMap<>(HelperSeat.class);
        for (HelperSeat seat : HelperSeat.dispatchOrder()) {
            String configured = props.getModels() == null ? null : props.getModels().get(seat.id());
            models.put(seat, SeatModels.requireModel(resolve(seat.id(), configured, file), seat.id(), source));
        }
        String synthesis = SeatModels.requireModel(
                resolve(Seats.SYNTH, props.getSynthesisModel(), file), Seats.SYNTH, source);

        SeatModels result = new SeatModels(models, synthesis);
        LOG.debug("Seat models resolved: helpers={}, synthesis={}", result.helperModels(), synthesis);
        return result;
    }

    private String resolve(String seatId, String configured, JSONObject file) {
        String fromEnv = environment.getProperty(ENV_PREFIX + seatId.toUpperCase(Locale.ROOT));
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        if (file != null && file.has(seatId)) {
            return tagOf(file.opt(seatId));
        }
        return configured;
    }

    private static String tagOf(Object entry) {
        if (entry instanceof String s) {
            return s;
        }
        if (entry instanceof JSONObject o) {
            return o.optString("tag", null);
        }
        return null;
    }

    private JSONObject readConfigFile() {
        String location = props.getConfigFile();
        if (location == null || location.isBlank()) {
            return null;
        }
        Path path = Path.of(location.trim());
        try {
            return new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SeatConfigurationException("Cannot read seat configuration file", location, e);
        } catch (JSONException e) {
            throw new SeatConfigurationException("Seat configuration file is not a JSON object", location, e);
        }
    }
}
