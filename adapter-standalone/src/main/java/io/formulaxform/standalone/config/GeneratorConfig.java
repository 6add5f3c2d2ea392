package io.formulaxform.standalone.config;

import java.util.List;

/**
 * Configuration of the standalone generator.
 *
 * <p>
 * Every field has a default except {@code caseFile}. Use {@link #builder()} to construct
 * instances.
 *
 * @param caseFile      YAML case file to generate from (required)
 * @param outputDir     directory receiving the generated units
 * @param tmpDir        scratch directory for the compile check, removed afterwards
 * @param checkEnabled  run the native compile check on the volume unit
 * @param checkCommand  compile command; {@value #UNIT_PLACEHOLDER} is replaced by the unit path
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 */
public record GeneratorConfig(
        String caseFile,
        String outputDir,
        String tmpDir,
        boolean checkEnabled,
        List<String> checkCommand,
        String loggingFormat,
        String loggingLevel) {

    /** Token in {@link #checkCommand()} replaced by the path of the unit under check. */
    public static final String UNIT_PLACEHOLDER = "{unit}";

    /** Syntax-only compile of the unit with warnings silenced. */
    public static final List<String> DEFAULT_CHECK_COMMAND = List.of("cc", "-fsyntax-only", "-w", UNIT_PLACEHOLDER);

    public GeneratorConfig {
        checkCommand = List.copyOf(checkCommand);
    }

    /** Creates a new builder with the defaults applied. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link GeneratorConfig}. */
    public static final class Builder {
        private String caseFile;
        private String outputDir = "./src";
        private String tmpDir = "./tmp";
        private boolean checkEnabled = false;
        private List<String> checkCommand = DEFAULT_CHECK_COMMAND;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder caseFile(String caseFile) {
            this.caseFile = caseFile;
            return this;
        }

        public Builder outputDir(String outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder tmpDir(String tmpDir) {
            this.tmpDir = tmpDir;
            return this;
        }

        public Builder checkEnabled(boolean checkEnabled) {
            this.checkEnabled = checkEnabled;
            return this;
        }

        public Builder checkCommand(List<String> checkCommand) {
            this.checkCommand = checkCommand;
            return this;
        }

        /** Sets the compile command from a whitespace-separated string. */
        public Builder checkCommand(String checkCommand) {
            this.checkCommand = List.of(checkCommand.trim().split("\\s+"));
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if no case file was set
         */
        public GeneratorConfig build() {
            if (caseFile == null || caseFile.isBlank()) {
                throw new ConfigLoadException(
                        "Missing required configuration 'case.file' (or FXF_CASE_FILE environment variable)");
            }
            return new GeneratorConfig(
                    caseFile, outputDir, tmpDir, checkEnabled, checkCommand, loggingFormat, loggingLevel);
        }
    }
}
