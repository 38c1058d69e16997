package io.upgradejourney.models;

import io.upgradejourney.exceptions.SequenceException;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered list of versions a run walks through. The first entry is the bootstrap
 * version, the rest are upgrade targets applied in order. Repeated entries are
 * allowed and simply repeat a step.
 */
@EqualsAndHashCode
public final class VersionSequence implements Iterable<String> {

    private final List<String> versions;

    private VersionSequence(List<String> versions) {
        this.versions = versions;
    }

    public static VersionSequence of(List<String> versions) {
        if (versions == null || versions.isEmpty()) {
            throw new SequenceException("Version sequence must be non-empty");
        }
        for (int i = 0; i < versions.size(); i++) {
            String version = versions.get(i);
            if (version == null || version.isBlank()) {
                throw new SequenceException("Version at position " + i + " is blank");
            }
        }
        return new VersionSequence(List.copyOf(versions));
    }

    public static VersionSequence of(String... versions) {
        return of(List.of(versions));
    }

    public String get(int index) {
        return versions.get(index);
    }

    public int size() {
        return versions.size();
    }

    public String bootstrapVersion() {
        return versions.get(0);
    }

    /**
     * Versions at positions {@code 0..uptoIndex} inclusive.
     */
    public List<String> window(int uptoIndex) {
        if (uptoIndex < 0 || uptoIndex >= versions.size()) {
            throw new IndexOutOfBoundsException("Step " + uptoIndex + " outside sequence of length " + versions.size());
        }
        return Collections.unmodifiableList(versions.subList(0, uptoIndex + 1));
    }

    @Override
    public Iterator<String> iterator() {
        return versions.iterator();
    }

    @Override
    public String toString() {
        return String.join(" -> ", versions);
    }
}
