package com.keg.directory;

/**
 * Capability to build a typed domain record out of a {@link RawEntry}.
 * <p>
 * Implementations usually close over a field-name mapping taken from configuration, so the
 * same record type can be read from differently shaped directory schemas.
 *
 * @param <T> the domain type produced
 */
@FunctionalInterface
public interface DirectoryEntryMapper<T> {

    T fromEntry(RawEntry entry);
}
