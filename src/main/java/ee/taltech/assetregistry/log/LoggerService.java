package ee.taltech.assetregistry.log;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Append-only JSON-lines audit trail of registry mutations.
 */
@Component
public class LoggerService {

    private final Path logFile;
    private final Set<PosixFilePermission> dirPerms =
            PosixFilePermissions.fromString("rwx------");
    private final Set<PosixFilePermission> filePerms =
            PosixFilePermissions.fromString("rw-------");

    public LoggerService(@Value("${assetregistry.audit-log:logs/audit.log}") String logFile) {
        this.logFile = Path.of(logFile).toAbsolutePath().normalize();
        secureSetup();
    }

    private void secureSetup() {
        try {
            Path dir = logFile.getParent();

            if (!Files.exists(dir)) {
                Files.createDirectories(dir);
            }

            restrict(dir, dirPerms);

            if (!Files.exists(logFile)) {
                Files.createFile(logFile);
            }

            restrict(logFile, filePerms);

        } catch (Exception e) {
            System.err.println("FATAL: cannot initialize audit logging: " + e.getMessage());
        }
    }

    /**
     * Writes the line once the surrounding transaction commits; nothing is written on rollback.
     * Outside a transaction the line is written immediately.
     */
    public void logAfterCommit(String event, String principal, String details) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            log(event, principal, details);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                log(event, principal, details);
            }
        });
    }

    public synchronized void log(String event, String principal, String details) {
        String ts = java.time.Instant.now().toString();
        String line = String.format(
                "{\"ts\":\"%s\",\"event\":\"%s\",\"principal\":%s,\"details\":\"%s\"}%n",
                ts, escape(event), principal == null ? "null" : "\"" + escape(principal) + "\"", escape(details)
        );

        try {
            Files.writeString(
                    logFile,
                    line,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            );

            // reapply perms in case of FS behavior / external tampering
            restrict(logFile, filePerms);

        } catch (Exception e) {
            System.err.println("FATAL: cannot write audit log: " + e.getMessage());
        }
    }

    public Path getLogFile() {
        return logFile;
    }

    private void restrict(Path path, Set<PosixFilePermission> perms) {
        try {
            Files.setPosixFilePermissions(path, perms);
        } catch (UnsupportedOperationException e) {
            // non-POSIX FS, nothing to tighten
        } catch (Exception e) {
            System.err.println("WARN: cannot restrict permissions of " + path + ": " + e.getMessage());
        }
    }

    static String escape(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }
}
