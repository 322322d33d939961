package com.mainframe.migration.cli.model;

import com.mainframe.migration.pipeline.MigrationJob;
import com.mainframe.migration.pipeline.PipelineConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Job and configuration derived from valid options. Keeps MigrateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedMigrateOptions {
    MigrationJob job;
    PipelineConfig config;
}
