package io.redisks.store;

public sealed class RedisStoreException extends RuntimeException
    permits RedisStoreException.OperationFailed,
            RedisStoreException.ScanFailed,
            RedisStoreException.ScriptLoadFailed {

    protected RedisStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class OperationFailed extends RedisStoreException {
        private final String operation;

        public OperationFailed(String operation, Throwable cause) {
            super("Redis operation failed: " + operation, cause);
            this.operation = operation;
        }

        public String operation() {
            return operation;
        }
    }

    public static final class ScanFailed extends RedisStoreException {
        public ScanFailed(Throwable cause) {
            super("Index scan failed", cause);
        }
    }

    public static final class ScriptLoadFailed extends RedisStoreException {
        private final String script;

        public ScriptLoadFailed(String script, Throwable cause) {
            super("Failed to load lua script '" + script + "'", cause);
            this.script = script;
        }

        public String script() {
            return script;
        }
    }
}
