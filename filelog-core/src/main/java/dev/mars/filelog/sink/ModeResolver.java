/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.filelog.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps a requested open mode onto {@link OpenMode}.
 * <p>
 * Resolution rules, in priority order:
 * <ol>
 *   <li>{@code closeAfterWrite == true} always yields {@link OpenMode#APPEND}, so that
 *       the repeated open/close cycle never truncates earlier messages.</li>
 *   <li>{@code "append"}, {@code ">>"} or the platform's numeric {@code O_APPEND} flag
 *       yield {@link OpenMode#APPEND}.</li>
 *   <li>Anything else yields {@link OpenMode#TRUNCATE}.</li>
 * </ol>
 * <p>
 * <b>Resolution never fails.</b> Unrecognized or garbled values (including {@code null})
 * silently degrade to {@link OpenMode#TRUNCATE}. Matching is exact and case-sensitive, except
 * that a single trailing {@code '\n'} is tolerated ({@code "append\n"} appends, while
 * {@code "append\r\n"} and {@code "append\n\n"} do not).
 */
public final class ModeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ModeResolver.class);

    /** Keyword requesting truncation; the default mode. */
    public static final String WRITE = "write";

    /** Keyword requesting append. */
    public static final String APPEND = "append";

    /** Shell-style truncate operator. */
    public static final String WRITE_OPERATOR = ">";

    /** Shell-style append operator. */
    public static final String APPEND_OPERATOR = ">>";

    /**
     * Numeric value of {@code O_APPEND} on the running platform.
     * <p>
     * Linux uses {@code 02000} (1024); macOS, the BSDs and the Windows CRT use {@code 0x0008}.
     */
    public static final int PLATFORM_APPEND_FLAG = appendFlagFor(System.getProperty("os.name", ""));

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private ModeResolver() {
    }

    /**
     * Resolves the open mode for a sink.
     *
     * @param closeAfterWrite whether the sink reopens the file for every message
     * @param requestedMode   the configured mode keyword, operator or numeric flag; may be null
     * @return the resolved mode, never null
     */
    public static OpenMode resolve(boolean closeAfterWrite, String requestedMode) {
        if (closeAfterWrite) {
            if (requestedMode != null && !isAppendRequest(requestedMode)) {
                LOG.debug("closeAfterWrite forces append mode, ignoring requested mode '{}'", requestedMode);
            }
            return OpenMode.APPEND;
        }
        if (requestedMode == null) {
            return OpenMode.TRUNCATE;
        }
        if (isAppendRequest(requestedMode)) {
            return OpenMode.APPEND;
        }
        if (!WRITE.equals(requestedMode) && !WRITE_OPERATOR.equals(requestedMode)) {
            LOG.debug("Unrecognized mode '{}', defaulting to truncate", requestedMode);
        }
        return OpenMode.TRUNCATE;
    }

    /**
     * Resolves the open mode from a raw numeric open flag.
     *
     * @param closeAfterWrite whether the sink reopens the file for every message
     * @param openFlag        numeric flag; only an exact match of {@link #PLATFORM_APPEND_FLAG} selects append
     * @return the resolved mode, never null
     */
    public static OpenMode resolve(boolean closeAfterWrite, int openFlag) {
        return resolve(closeAfterWrite, Integer.toString(openFlag));
    }

    private static boolean isAppendRequest(String requested) {
        String mode = requested.endsWith("\n") ? requested.substring(0, requested.length() - 1) : requested;
        if (APPEND.equals(mode) || APPEND_OPERATOR.equals(mode)) {
            return true;
        }
        // Digits only, compared numerically so "01024" still matches; BigInteger avoids overflow
        return DIGITS.matcher(mode).matches()
                && new BigInteger(mode).equals(BigInteger.valueOf(PLATFORM_APPEND_FLAG));
    }

    static int appendFlagFor(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("linux")) {
            return 02000;
        }
        return 0x0008;
    }
}
