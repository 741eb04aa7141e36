package com.keg.directory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One search result as returned by the directory server: its fully-qualified name plus the
 * textual and binary attribute values.
 * <p>
 * Attribute names are looked up case-insensitively, like LDAP itself does. The accessors
 * implement the lenient reading rules every mapper relies on: absent attributes read as empty
 * values, never as errors.
 *
 * @param dn               the fully-qualified distinguished name of the entry
 * @param attributes       textual attributes, name to all values
 * @param binaryAttributes binary attributes (e.g. photos), name to all values
 */
public record RawEntry(
        String dn,
        Map<String, List<String>> attributes,
        Map<String, List<byte[]>> binaryAttributes
) {

    public RawEntry {
        if (dn == null) {
            throw new IllegalArgumentException("dn must not be null");
        }
        attributes = caseInsensitiveCopy(attributes);
        binaryAttributes = caseInsensitiveCopy(binaryAttributes);
    }

    /**
     * Creates an entry without binary attributes.
     */
    public static RawEntry of(String dn, Map<String, List<String>> attributes) {
        return new RawEntry(dn, attributes, Map.of());
    }

    /**
     * Returns the first value of the attribute, or an empty string if it is absent.
     */
    public String firstValue(String attribute) {
        List<String> values = attributes.get(attribute);
        return values == null || values.isEmpty() ? "" : values.get(0);
    }

    /**
     * Returns all values of the attribute, or an empty list if it is absent.
     */
    public List<String> values(String attribute) {
        return attributes.getOrDefault(attribute, List.of());
    }

    /**
     * Returns true iff the first value equals {@code "true"}, ignoring case.
     */
    public boolean flag(String attribute) {
        return "true".equalsIgnoreCase(firstValue(attribute));
    }

    /**
     * Parses the first value as an integer, falling back to 0.
     */
    public int number(String attribute) {
        try {
            return Integer.parseInt(firstValue(attribute).strip());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Returns the first binary value, or an empty array if the attribute is absent.
     */
    public byte[] firstBinary(String attribute) {
        List<byte[]> values = binaryAttributes.get(attribute);
        return values == null || values.isEmpty() ? new byte[0] : values.get(0).clone();
    }

    /**
     * Returns true iff every named attribute is present (textual or binary).
     */
    public boolean containsAll(String... attributeNames) {
        return Arrays.stream(attributeNames)
                .allMatch(name -> attributes.containsKey(name) || binaryAttributes.containsKey(name));
    }

    private static <V> Map<String, List<V>> caseInsensitiveCopy(Map<String, List<V>> source) {
        Map<String, List<V>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            source.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        return Collections.unmodifiableMap(copy);
    }
}
