/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
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
package org.neo4j.rest.connection;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A Neo4j server version in the four part {@code major.minor.build.revision} form.
 * <p>
 * Instances are usually created with {@link #parse(String)} from the {@code neo4j_version} field of the root
 * endpoint. The optional {@link #qualifier()} retains the pre-release tag of the original string, such as
 * {@code M02} or {@code SNAPSHOT}. It is informational only and does not take part in ordering.
 * <p>
 * Note: the natural ordering is inconsistent with {@link #equals(Object)} when qualifiers differ.
 *
 * @param major the major version
 * @param minor the minor version
 * @param build the build number
 * @param revision the revision number
 * @param qualifier the pre-release qualifier or {@code null}
 * @since 1.0.0
 */
public record ServerVersion(int major, int minor, int build, int revision, String qualifier)
        implements Comparable<ServerVersion> {
    /**
     * The version used when the server version is unknown or cannot be parsed.
     */
    public static final ServerVersion ZERO = new ServerVersion(0, 0, 0, 0, null);

    // 1.5.M02 style milestones, the milestone number becomes the revision
    private static final Pattern MILESTONE_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)\\.?M(\\d+)(.*)$");
    private static final Pattern NUMERIC_PATTERN =
            Pattern.compile("^(\\d+)\\.(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:[-+.]?([^\\d.].*))?$");

    private static final Comparator<ServerVersion> COMPARATOR = Comparator.comparingInt(ServerVersion::major)
            .thenComparingInt(ServerVersion::minor)
            .thenComparingInt(ServerVersion::build)
            .thenComparingInt(ServerVersion::revision);

    public ServerVersion {
        if (major < 0 || minor < 0 || build < 0 || revision < 0) {
            throw new IllegalArgumentException("Version components must not be negative");
        }
    }

    /**
     * Creates a version without qualifier.
     *
     * @param major the major version
     * @param minor the minor version
     * @param build the build number
     * @param revision the revision number
     * @return the version
     */
    public static ServerVersion of(int major, int minor, int build, int revision) {
        return new ServerVersion(major, minor, build, revision, null);
    }

    /**
     * Creates a {@code major.minor.0.0} version.
     *
     * @param major the major version
     * @param minor the minor version
     * @return the version
     */
    public static ServerVersion of(int major, int minor) {
        return of(major, minor, 0, 0);
    }

    /**
     * Parses a server version string.
     * <p>
     * Dotted numeric forms with two to four components are accepted, optionally followed by a qualifier. The
     * milestone form {@code <major>.<minor>.M<n>} maps the milestone number to the revision, so {@code 1.5.M02}
     * becomes {@code 1.5.0.2}. This method never fails, any input it does not understand yields {@link #ZERO}.
     *
     * @param version the version string, may be {@code null}
     * @return the parsed version or {@link #ZERO}
     */
    public static ServerVersion parse(String version) {
        if (version == null || version.isBlank()) {
            return ZERO;
        }
        var trimmed = version.trim();
        try {
            var milestone = MILESTONE_PATTERN.matcher(trimmed);
            if (milestone.matches()) {
                return new ServerVersion(
                        Integer.parseInt(milestone.group(1)),
                        Integer.parseInt(milestone.group(2)),
                        0,
                        Integer.parseInt(milestone.group(3)),
                        "M" + milestone.group(3) + milestone.group(4));
            }
            var numeric = NUMERIC_PATTERN.matcher(trimmed);
            if (numeric.matches()) {
                return new ServerVersion(
                        Integer.parseInt(numeric.group(1)),
                        Integer.parseInt(numeric.group(2)),
                        optionalComponent(numeric, 3),
                        optionalComponent(numeric, 4),
                        numeric.group(5));
            }
        } catch (NumberFormatException ignored) {
            // component does not fit into an int
        }
        return ZERO;
    }

    private static int optionalComponent(Matcher matcher, int group) {
        var value = matcher.group(group);
        return value != null ? Integer.parseInt(value) : 0;
    }

    /**
     * Indicates if this version is the same as or newer than the given one, ignoring qualifiers.
     *
     * @param other the version to compare with
     * @return {@code true} if this version is at least {@code other}
     */
    public boolean isAtLeast(ServerVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(ServerVersion other) {
        return COMPARATOR.compare(this, Objects.requireNonNull(other));
    }

    @Override
    public String toString() {
        return "%d.%d.%d.%d".formatted(major, minor, build, revision);
    }
}
