package dev.contractgate.core.conformance;

import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.util.Hashing;

/**
 * Stable tracking ids for violations.
 * <p>
 * The id covers contract, check, normalized path, line and rule but not the message,
 * so rewording a message keeps the same violation.
 */
public final class ViolationIds {

    public static final String PREFIX = "V-";

    private static final int HASH_LENGTH = 12;

    private ViolationIds() {
    }

    public static String compute(String contractId, String checkId, String file, Integer line, String rule) {
        String path = file == null ? "" : file.replace('\\', '/');
        String location = line == null ? "file" : Integer.toString(line);
        String key = String.join("|", nullToEmpty(contractId), nullToEmpty(checkId), path, location, nullToEmpty(rule));
        return PREFIX + Hashing.shortSha256(key, HASH_LENGTH);
    }

    public static String of(CheckResult result) {
        return compute(result.contractId(), result.checkId(), result.file(), result.line(), result.rule());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
