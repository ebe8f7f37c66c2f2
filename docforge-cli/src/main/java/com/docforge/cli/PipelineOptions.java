package com.docforge.cli;

import com.docforge.core.config.ConfigLoader;
import com.docforge.core.config.PipelineSettings;
import com.docforge.core.config.ProjectConfig;
import com.docforge.core.model.DocstringStyle;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Options shared by the commands that run the pipeline. Unset options keep the value from
 * the configuration file and environment.
 */
public class PipelineOptions {

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: .docforge.yaml)")
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-s", "--style"}, description = "Docstring style: google, numpy or rst")
    String style;

    @Option(names = "--max-iterations", description = "Refinement iterations per element (default: 3)")
    Integer maxIterations;

    @Option(names = "--threshold", description = "Confidence needed to accept a docstring (default: 0.8)")
    Double threshold;

    @Option(names = "--overwrite", description = "Replace existing docstrings instead of skipping them")
    boolean overwrite;

    /**
     * Loads the configuration file and applies environment overrides.
     *
     * @param env environment variables
     * @return merged configuration
     */
    public ProjectConfig loadConfig(Map<String, String> env) {
        return ConfigLoader.load(configPath).withEnvironment(env);
    }

    /**
     * Applies command-line overrides to the configured settings.
     *
     * @param config merged configuration
     * @return settings for this run
     * @throws IllegalArgumentException if a value is out of range or the style is unknown
     */
    public PipelineSettings settings(ProjectConfig config) {
        PipelineSettings settings = config.pipelineSettings();
        if (style != null) {
            settings = settings.withStyle(DocstringStyle.fromId(style));
        }
        if (maxIterations != null) {
            settings = settings.withMaxIterations(maxIterations);
        }
        if (threshold != null) {
            settings = settings.withThreshold(threshold);
        }
        if (overwrite) {
            settings = settings.withOverwrite(true);
        }
        return settings;
    }
}
