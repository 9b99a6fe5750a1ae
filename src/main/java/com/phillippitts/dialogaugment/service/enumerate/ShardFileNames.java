package com.phillippitts.dialogaugment.service.enumerate;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Group-number hints encoded in shard file names and group ids.
 *
 * <p>{@code dialogues_003.json} hints group number 3; group id {@code "3_0"} carries number 3.
 */
final class ShardFileNames {

    private static final Pattern LAST_NUMBER = Pattern.compile("(\\d+)(?!.*\\d)");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)(?:_|$)");

    private ShardFileNames() {
    }

    static OptionalInt hint(String shardId) {
        int dot = shardId.lastIndexOf('.');
        String stem = dot > 0 ? shardId.substring(0, dot) : shardId;
        Matcher m = LAST_NUMBER.matcher(stem);
        return m.find() ? parse(m.group(1)) : OptionalInt.empty();
    }

    static OptionalInt groupNumber(String groupId) {
        if (groupId == null) {
            return OptionalInt.empty();
        }
        Matcher m = LEADING_NUMBER.matcher(groupId);
        return m.find() ? parse(m.group(1)) : OptionalInt.empty();
    }

    private static OptionalInt parse(String digits) {
        try {
            return OptionalInt.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
