package org.kiln.options;

/**
 * Configuration option keys and defaults shared by the core and the CLI.
 */
public final class KilnOptions {

    private KilnOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        public static final String ENV_VAR = "KILN_PROFILE";

        public static final String CONFIG_FILE = "kiln.yaml";
    }

    /**
     * Naming-related settings.
     */
    public static final class Naming {
        private Naming() {}

        /**
         * Maximum length for generated constraint/index names.
         * Default: 30
         */
        public static final String MAX_LENGTH_KEY = "kiln.naming.maxLength";
        public static final int MAX_LENGTH_DEFAULT = 30;

        /**
         * Physical name strategy: none | snake_case.
         */
        public static final String STRATEGY_KEY = "kiln.naming.strategy";
        public static final String STRATEGY_DEFAULT = "none";
    }

    public static final class Database {
        private Database() {}

        public static final String DIALECT_KEY = "kiln.database.dialect";
        public static final String URL_KEY = "kiln.database.url";
        public static final String USERNAME_KEY = "kiln.database.username";
        public static final String PASSWORD_KEY = "kiln.database.password";
    }

    public static final class Schema {
        private Schema() {}

        public static final String PATH_KEY = "kiln.schema.path";
        public static final String PATH_DEFAULT = "schema.yaml";
    }

    public static final class Migrations {
        private Migrations() {}

        public static final String DIRECTORY_KEY = "kiln.migrations.directory";
        public static final String DIRECTORY_DEFAULT = "migrations";

        /**
         * Ledger table holding one row per applied migration.
         */
        public static final String LEDGER_TABLE = "_kiln_migrations";
    }

    public static final class Query {
        private Query() {}

        /**
         * Per-statement timeout in seconds, 0 disables it.
         */
        public static final String TIMEOUT_KEY = "kiln.query.timeoutSeconds";
        public static final int TIMEOUT_DEFAULT = 0;
    }
}
