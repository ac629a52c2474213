package com.github.crusty;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.crusty.parser.RustParser;

public class ConfigReader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigReader.class);

    static final String CONFIG_FILE = "crusty.cfg";

    /**
     * Reads {@code crusty.cfg} from the working directory, or the defaults bundled on the
     * classpath when there is none.
     */
    public static Config readConfig() {
        var local = Path.of(CONFIG_FILE);
        if (Files.isRegularFile(local)) {
            try (var in = new FileInputStream(local.toFile())) {
                logger.debug("reading configuration from {}", local.toAbsolutePath());
                return readConfig(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        try (var in = ConfigReader.class.getResourceAsStream("/" + CONFIG_FILE)) {
            if (in == null) {
                logger.debug("no {} found, using built-in defaults", CONFIG_FILE);
                return new Config();
            }
            return readConfig(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Config readConfig(InputStream in) throws IOException {
        var config = new Config();
        Properties properties = new Properties();
        properties.load(in);

        Arrays.stream(properties.getProperty("lookupPath", "").split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .forEach(config.lookupPath::add);
        config.indentWidth = Integer.parseInt(properties.getProperty("indentWidth", "4").strip());
        config.fallibleErrorType = properties.getProperty("fallibleErrorType", RustParser.DEFAULT_ERROR_TYPE).strip();
        config.rangeLoops = Boolean.parseBoolean(properties.getProperty("rangeLoops", "true").strip());
        return config;
    }

    public static class Config {
        List<String> lookupPath = new ArrayList<>();
        int indentWidth = 4;
        String fallibleErrorType = RustParser.DEFAULT_ERROR_TYPE;
        boolean rangeLoops = true;

        public void applyConfig(ConfigTarget ct) {
            ct.setLookupPath(lookupPath);
            ct.setIndentWidth(indentWidth);
            ct.setFallibleErrorType(fallibleErrorType);
            ct.setRangeLoops(rangeLoops);
        }
    }

    public interface ConfigTarget {
        void setLookupPath(List<String> lookupPath);

        void setIndentWidth(int indentWidth);

        void setFallibleErrorType(String fallibleErrorType);

        void setRangeLoops(boolean rangeLoops);
    }

}
