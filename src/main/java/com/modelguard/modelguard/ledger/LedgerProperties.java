package com.modelguard.modelguard.ledger;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized ledger and loader configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private String sourceFilePath = LedgerConstants.DEFAULT_SOURCE_FILE_PATH;
    private String sourceIdColumn = LedgerConstants.DEFAULT_SOURCE_ID_COLUMN;
    private List<String> sourceTextColumns = new ArrayList<>(LedgerConstants.DEFAULT_SOURCE_TEXT_COLUMNS);
    private List<String> sourceMetadataColumns = new ArrayList<>(LedgerConstants.DEFAULT_SOURCE_METADATA_COLUMNS);
    private String sourceLabelColumn = LedgerConstants.DEFAULT_SOURCE_LABEL_COLUMN;
    private Long seed;
    private double stepFraction = LedgerConstants.DEFAULT_STEP_FRACTION;
    private Double initialFraction;
    private double maxFraction = LedgerConstants.DEFAULT_MAX_FRACTION;
    private boolean applySourceCorrections;
    private String cron = LedgerConstants.DEFAULT_CRON;

    public String getSourceFilePath() {
        return sourceFilePath;
    }

    public void setSourceFilePath(String sourceFilePath) {
        this.sourceFilePath = sourceFilePath;
    }

    public String getSourceIdColumn() {
        return sourceIdColumn;
    }

    public void setSourceIdColumn(String sourceIdColumn) {
        this.sourceIdColumn = sourceIdColumn;
    }

    public List<String> getSourceTextColumns() {
        return sourceTextColumns;
    }

    public void setSourceTextColumns(List<String> sourceTextColumns) {
        this.sourceTextColumns = sourceTextColumns;
    }

    public List<String> getSourceMetadataColumns() {
        return sourceMetadataColumns;
    }

    public void setSourceMetadataColumns(List<String> sourceMetadataColumns) {
        this.sourceMetadataColumns = sourceMetadataColumns;
    }

    public String getSourceLabelColumn() {
        return sourceLabelColumn;
    }

    public void setSourceLabelColumn(String sourceLabelColumn) {
        this.sourceLabelColumn = sourceLabelColumn;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public double getStepFraction() {
        return stepFraction;
    }

    public void setStepFraction(double stepFraction) {
        this.stepFraction = stepFraction;
    }

    public Double getInitialFraction() {
        return initialFraction;
    }

    public void setInitialFraction(Double initialFraction) {
        this.initialFraction = initialFraction;
    }

    public double getMaxFraction() {
        return maxFraction;
    }

    public void setMaxFraction(double maxFraction) {
        this.maxFraction = maxFraction;
    }

    public boolean isApplySourceCorrections() {
        return applySourceCorrections;
    }

    public void setApplySourceCorrections(boolean applySourceCorrections) {
        this.applySourceCorrections = applySourceCorrections;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }
}
