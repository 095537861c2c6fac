package com.example.alpenglow.theoremmap.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Run settings. The location entries are filled from the command line flags through placeholders
 * in {@code application.yml}, e.g. {@code --specs-dir=specs}; the command also accepts
 * {@code --specs-dir specs}.
 */
@ConfigurationProperties(prefix = "mapping")
@Validated
public class MappingProperties {

    public static final String DEFAULT_OUTPUT_DIR = "./theorem_mapping_reports";
    public static final String DEFAULT_PROJECT_ROOT = ".";

    private String whitepaper;
    private String specsDir;
    private String proofsDir;
    private String outputDir = DEFAULT_OUTPUT_DIR;
    private String projectRoot = DEFAULT_PROJECT_ROOT;
    @NotBlank
    private String formalExtension = ".tla";
    @Valid
    private final Report report = new Report();

    public String getWhitepaper() {
        return whitepaper;
    }

    public void setWhitepaper(String whitepaper) {
        this.whitepaper = whitepaper;
    }

    public String getSpecsDir() {
        return specsDir;
    }

    public void setSpecsDir(String specsDir) {
        this.specsDir = specsDir;
    }

    public String getProofsDir() {
        return proofsDir;
    }

    public void setProofsDir(String proofsDir) {
        this.proofsDir = proofsDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }

    public String getFormalExtension() {
        return formalExtension;
    }

    public void setFormalExtension(String formalExtension) {
        this.formalExtension = formalExtension;
    }

    public Report getReport() {
        return report;
    }

    public static final class Report {
        private String title = "Alpenglow Theorem Mapping Report";
        private boolean trackUnmapped = false;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double coverageWarningThreshold = 0.8;

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public boolean isTrackUnmapped() {
            return trackUnmapped;
        }

        public void setTrackUnmapped(boolean trackUnmapped) {
            this.trackUnmapped = trackUnmapped;
        }

        public double getCoverageWarningThreshold() {
            return coverageWarningThreshold;
        }

        public void setCoverageWarningThreshold(double coverageWarningThreshold) {
            this.coverageWarningThreshold = coverageWarningThreshold;
        }
    }
}
