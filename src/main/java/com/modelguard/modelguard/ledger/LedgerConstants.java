package com.modelguard.modelguard.ledger;

import java.util.List;

/**
 * Shared constants for the incremental ledger.
 */
public final class LedgerConstants {

    private LedgerConstants() {
    }

    public static final String DEFAULT_SOURCE_FILE_PATH = "source/population.csv";
    public static final String DEFAULT_SOURCE_ID_COLUMN = "productid";
    public static final List<String> DEFAULT_SOURCE_TEXT_COLUMNS = List.of("designation", "description");
    public static final List<String> DEFAULT_SOURCE_METADATA_COLUMNS = List.of();
    public static final String DEFAULT_SOURCE_LABEL_COLUMN = "prdtypecode";
    public static final double DEFAULT_STEP_FRACTION = 0.03;
    public static final double DEFAULT_MAX_FRACTION = 1.0;
    public static final String DEFAULT_CRON = "0 0 2 * * SUN";

    public static final String ENTITY_TABLE = "ledger_entity";
    public static final String BATCH_TABLE = "ledger_batch";
    public static final String HISTORY_TABLE = "ledger_history";

    public static final String BATCH_NAME_PREFIX = "load_";
    public static final String BATCH_RETRY_INFIX = "_r";
    public static final int BATCH_NAME_MAX_LENGTH = 100;
    public static final int INSERT_CHUNK_SIZE = 500;

    /** Fractions are held in basis points so that repeated steps never accumulate rounding error. */
    public static final int BASIS_POINTS = 10_000;

    public static final String MSG_SEED_REQUIRED = "ledger.seed must be configured for deterministic sampling";
    public static final String MSG_INVALID_FRACTION = "%s must be in (0, 1], got %s";
    public static final String MSG_SOURCE_NOT_FOUND = "Source population not found in resources: %s";
    public static final String MSG_SOURCE_READ_FAILED = "Failed to read source population: %s";
    public static final String MSG_SOURCE_EMPTY = "Source population is empty: %s";
    public static final String MSG_SOURCE_COLUMN_MISSING = "Source column %s not found in %s";
    public static final String MSG_SOURCE_DUPLICATE_ID = "Duplicate entity id %d in source population";
    public static final String MSG_BATCH_NOT_RUNNING = "Batch %d is not running";
    public static final String MSG_BATCH_NOT_FOUND = "Batch %d not found";
    public static final String MSG_STALE_RECOVERED = "Marked failed on startup: batch was left running by an interrupted load";
}
