package com.example.alpenglow.theoremmap.validation;

import com.example.alpenglow.theoremmap.model.MappingRequest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries the raw location settings through the validation stages. Validators may fill defaults
 * and attach notices; {@link #toRequest()} turns the result into paths.
 */
public class ValidationContext {

  private String whitepaper;
  private String specsDir;
  private String proofsDir;
  private String outputDir;
  private String projectRoot;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String whitepaper, String specsDir, String proofsDir, String outputDir, String projectRoot) {
    this.whitepaper = whitepaper;
    this.specsDir = specsDir;
    this.proofsDir = proofsDir;
    this.outputDir = outputDir;
    this.projectRoot = projectRoot;
  }

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

  /** Adds a user visible notice emitted during validation. */
  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }

  public MappingRequest toRequest() {
    return MappingRequest.builder()
        .whitepaper(Path.of(whitepaper))
        .specsDir(Path.of(specsDir))
        .proofsDir(Path.of(proofsDir))
        .outputDir(Path.of(outputDir))
        .projectRoot(Path.of(projectRoot))
        .build();
  }
}
