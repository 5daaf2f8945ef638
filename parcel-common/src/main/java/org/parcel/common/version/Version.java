/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.parcel.common.version;

import com.google.common.base.Splitter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A package version of the form {@code MAJOR.MINOR.PATCH[-prerelease]}.
 *
 * <p>Versions are ordered by major, minor and patch numerically. A prerelease sorts below the release it
 * precedes ({@code 1.0.0-alpha < 1.0.0}); two prereleases are compared identifier by identifier, numeric
 * identifiers numerically, alphanumeric ones lexically, numeric below alphanumeric.
 */
public final class Version implements Comparable<Version> {

    private static final Pattern VERSION_PATTERN =
            Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)(?:-([a-zA-Z0-9.]+))?$");

    private static final Splitter DOT_SPLITTER = Splitter.on('.');

    /**
     * Orders version strings newest first. Never throws, malformed strings are compared leniently.
     */
    public static final Comparator<String> NEWEST_FIRST = (a, b) -> compare(b, a);

    private final long major;
    private final long minor;
    private final long patch;
    private final String prerelease;

    private Version(long major, long minor, long patch, String prerelease) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.prerelease = prerelease;
    }

    /**
     * Parse a version string.
     *
     * @param version the version string
     * @return the parsed version
     * @throws IllegalArgumentException if the string does not match {@code MAJOR.MINOR.PATCH[-prerelease]}
     */
    public static Version parse(String version) {
        if (version == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
        Matcher matcher = VERSION_PATTERN.matcher(version);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid version '" + version + "'. Expected semver (e.g., 1.0.0)");
        }
        String prerelease = matcher.group(4);
        if (prerelease != null && (prerelease.startsWith(".") || prerelease.endsWith(".")
                || prerelease.contains(".."))) {
            throw new IllegalArgumentException("Invalid prerelease in version '" + version + "'");
        }
        try {
            return new Version(Long.parseLong(matcher.group(1)), Long.parseLong(matcher.group(2)),
                    Long.parseLong(matcher.group(3)), prerelease);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version component out of range in '" + version + "'", e);
        }
    }

    public static boolean isValid(String version) {
        try {
            parse(version);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Compare two version strings without requiring them to be well-formed. Components that are missing
     * or not numeric count as 0.
     */
    public static int compare(String a, String b) {
        return lenient(a).compareTo(lenient(b));
    }

    private static Version lenient(String version) {
        if (version == null) {
            return new Version(0, 0, 0, null);
        }
        String core = version;
        String prerelease = null;
        int dash = version.indexOf('-');
        if (dash >= 0) {
            core = version.substring(0, dash);
            prerelease = version.substring(dash + 1);
            if (prerelease.isEmpty()) {
                prerelease = null;
            }
        }
        List<String> parts = DOT_SPLITTER.splitToList(core);
        return new Version(component(parts, 0), component(parts, 1), component(parts, 2), prerelease);
    }

    private static long component(List<String> parts, int index) {
        if (index >= parts.size()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(parts.get(index).trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public long getMajor() {
        return major;
    }

    public long getMinor() {
        return minor;
    }

    public long getPatch() {
        return patch;
    }

    public String getPrerelease() {
        return prerelease;
    }

    public boolean isPrerelease() {
        return prerelease != null;
    }

    @Override
    public int compareTo(Version other) {
        int result = Long.compare(major, other.major);
        if (result != 0) {
            return result;
        }
        result = Long.compare(minor, other.minor);
        if (result != 0) {
            return result;
        }
        result = Long.compare(patch, other.patch);
        if (result != 0) {
            return result;
        }
        return comparePrerelease(prerelease, other.prerelease);
    }

    private static int comparePrerelease(String a, String b) {
        if (Objects.equals(a, b)) {
            return 0;
        }
        // a release has higher precedence than any of its prereleases
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        List<String> left = DOT_SPLITTER.splitToList(a);
        List<String> right = DOT_SPLITTER.splitToList(b);
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int result = compareIdentifier(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareIdentifier(String a, String b) {
        boolean numericA = isNumeric(a);
        boolean numericB = isNumeric(b);
        if (numericA && numericB) {
            int result = Integer.compare(a.length(), b.length());
            return result != 0 ? result : a.compareTo(b);
        } else if (numericA) {
            return -1;
        } else if (numericB) {
            return 1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String identifier) {
        if (identifier.isEmpty()) {
            return false;
        }
        for (int i = 0; i < identifier.length(); i++) {
            if (!Character.isDigit(identifier.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Version)) {
            return false;
        }
        Version other = (Version) o;
        return major == other.major && minor == other.minor && patch == other.patch
                && Objects.equals(prerelease, other.prerelease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, prerelease);
    }

    @Override
    public String toString() {
        String core = major + "." + minor + "." + patch;
        return prerelease == null ? core : core + "-" + prerelease;
    }
}
