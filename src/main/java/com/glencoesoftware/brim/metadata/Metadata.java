/*
 * Copyright (C) 2025 Glencoe Software, Inc. All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.glencoesoftware.brim.metadata;

import com.glencoesoftware.brim.BrimLayout;
import com.glencoesoftware.brim.Utils;
import com.glencoesoftware.brim.exceptions.NotAContainerException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.store.ArrayStore;
import com.glencoesoftware.brim.store.StorePath;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Typed metadata of a group, stored under the {@code Metadata} attribute as
 * <pre>
 * {category: {key: {"type": tag, "value": value, "units": units}}}
 * </pre>
 * Entries of a data group override those of the container, which are used
 * as a fallback when reading.
 *
 * <p>Changes are staged in the store and persisted when it is flushed or
 * closed.</p>
 */
public class Metadata {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Metadata.class);

    static final String TYPE_KEY = "type";

    static final String VALUE_KEY = "value";

    static final String UNITS_KEY = "units";

    private final StorePath group;

    private final StorePath fallback;

    /**
     * Default constructor.
     *
     * @param group    group the metadata is attached to
     * @param fallback group read when an entry is missing from {@code group},
     *                 or {@code null}
     */
    public Metadata(StorePath group, StorePath fallback) {
        this.group = group;
        this.fallback = fallback;
    }

    private ArrayStore store() {
        return group.store;
    }

    /**
     * Gets an entry.
     *
     * @param category category of the entry
     * @param key      name of the entry
     * @return See above.
     * @throws NotFoundException if the entry is absent
     * @throws IOException       if the metadata cannot be read
     */
    public MetadataItem get(MetadataCategory category, String key) throws IOException {
        Map<String, Object> entry = findEntry(group, category, key);
        if (entry == null && fallback != null) {
            entry = findEntry(fallback, category, key);
        }
        if (entry == null) {
            throw new NotFoundException(String.format(
                "No metadata %s.%s in %s", category.getName(), key, group));
        }
        MetadataItem item = decodeEntry(category, key, entry);
        if (item.isUnitless() && (item.getType() == MetadataValue.Type.FLOAT
            || item.getType() == MetadataValue.Type.FLOAT_ARRAY)) {
            log.warn("Metadata {}.{} has no units", category.getName(), key);
        }
        return item;
    }

    /**
     * Checks whether an entry is present.
     *
     * @param category category of the entry
     * @param key      name of the entry
     * @return See above.
     * @throws IOException if the metadata cannot be read
     */
    public boolean contains(MetadataCategory category, String key) throws IOException {
        return findEntry(group, category, key) != null
            || (fallback != null && findEntry(fallback, category, key) != null);
    }

    /**
     * Sets an entry without units.
     *
     * @param category category of the entry
     * @param key      name of the entry
     * @param value    the value
     * @throws IOException if the metadata cannot be written
     */
    public void set(MetadataCategory category, String key, MetadataValue value)
        throws IOException {
        set(category, key, value, null);
    }

    /**
     * Sets an entry, replacing any previous value and type.
     *
     * @param category category of the entry
     * @param key      name of the entry
     * @param value    the value
     * @param units    units of the value or {@code null}
     * @throws IOException if the metadata cannot be written
     */
    public void set(MetadataCategory category, String key, MetadataValue value, String units)
        throws IOException {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Metadata key must not be empty");
        }
        Map<String, Object> attributes = store().getAttributes(group);
        Map<String, Object> metadata = section(attributes, BrimLayout.METADATA_ATTR);
        Map<String, Object> entries = section(metadata, category.getName());
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(TYPE_KEY, value.getType().getTag());
        entry.put(VALUE_KEY, value.encode());
        if (units != null) {
            entry.put(UNITS_KEY, units);
        }
        entries.put(key, entry);
        store().setAttributes(group, attributes);
        log.debug("Staged metadata {}.{} = {} on {}", category.getName(), key, value, group);
    }

    /**
     * Sets every entry of a nested mapping {@code {category: {key: value}}},
     * inferring value types. Units are left unset.
     *
     * @param dict entries to set
     * @throws IOException if the metadata cannot be written
     */
    public void putAll(Map<String, ? extends Map<String, ?>> dict) throws IOException {
        Map<String, Object> attributes = store().getAttributes(group);
        Map<String, Object> metadata = section(attributes, BrimLayout.METADATA_ATTR);
        for (Map.Entry<String, ? extends Map<String, ?>> c : dict.entrySet()) {
            MetadataCategory category = MetadataCategory.fromName(c.getKey());
            Map<String, Object> entries = section(metadata, category.getName());
            for (Map.Entry<String, ?> e : c.getValue().entrySet()) {
                MetadataValue value = MetadataValue.infer(e.getValue());
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put(TYPE_KEY, value.getType().getTag());
                entry.put(VALUE_KEY, value.encode());
                entries.put(e.getKey(), entry);
            }
        }
        store().setAttributes(group, attributes);
    }

    /**
     * Exports every entry, container entries overridden by group entries, as
     * {@code {category: {key: value}}}. Units are not part of this view.
     *
     * @return See above.
     * @throws IOException if the metadata cannot be read
     */
    public Map<String, Map<String, Object>> allToDict() throws IOException {
        Map<String, Map<String, Object>> dict = new LinkedHashMap<>();
        for (MetadataCategory category : MetadataCategory.values()) {
            Map<String, Object> values = toDict(category);
            if (!values.isEmpty()) {
                dict.put(category.getName(), values);
            }
        }
        return dict;
    }

    /**
     * Exports the entries of one category as {@code {key: value}}.
     *
     * @param category the category
     * @return See above.
     * @throws IOException if the metadata cannot be read
     */
    public Map<String, Object> toDict(MetadataCategory category) throws IOException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, MetadataItem> e : getItems(category).entrySet()) {
            values.put(e.getKey(), e.getValue().getValue().getValue());
        }
        return values;
    }

    /**
     * Gets every entry of one category, with units.
     *
     * @param category the category
     * @return See above.
     * @throws IOException if the metadata cannot be read
     */
    public Map<String, MetadataItem> getItems(MetadataCategory category) throws IOException {
        Map<String, MetadataItem> items = new LinkedHashMap<>();
        if (fallback != null) {
            collect(fallback, category, items);
        }
        collect(group, category, items);
        return items;
    }

    private void collect(StorePath node, MetadataCategory category,
        Map<String, MetadataItem> items) throws IOException {
        Map<String, Object> entries = readCategory(node, category);
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            items.put(e.getKey(), decodeEntry(category, e.getKey(),
                Utils.castToStringObjectMap(e.getValue())));
        }
    }

    private Map<String, Object> readCategory(StorePath node, MetadataCategory category)
        throws IOException {
        Map<String, Object> attributes = node.store.getAttributes(node);
        Object metadata = attributes.get(BrimLayout.METADATA_ATTR);
        if (metadata == null) {
            return new LinkedHashMap<>();
        }
        try {
            Object entries = Utils.castToStringObjectMap(metadata).get(category.getName());
            return entries == null
                ? new LinkedHashMap<>() : Utils.castToStringObjectMap(entries);
        } catch (IllegalArgumentException e) {
            throw new NotAContainerException("Malformed metadata in " + node, e);
        }
    }

    private Map<String, Object> findEntry(StorePath node, MetadataCategory category,
        String key) throws IOException {
        Object entry = readCategory(node, category).get(key);
        if (entry == null) {
            return null;
        }
        try {
            return Utils.castToStringObjectMap(entry);
        } catch (IllegalArgumentException e) {
            throw new NotAContainerException(String.format(
                "Malformed metadata %s.%s in %s", category.getName(), key, node), e);
        }
    }

    private MetadataItem decodeEntry(MetadataCategory category, String key,
        Map<String, Object> entry) throws NotAContainerException {
        try {
            MetadataValue.Type type = MetadataValue.Type.fromTag(
                String.valueOf(entry.get(TYPE_KEY)));
            MetadataValue value = MetadataValue.decode(type, entry.get(VALUE_KEY));
            Object units = entry.get(UNITS_KEY);
            return new MetadataItem(value, units == null ? null : units.toString());
        } catch (IllegalArgumentException e) {
            throw new NotAContainerException(String.format(
                "Malformed metadata %s.%s: %s", category.getName(), key, e.getMessage()), e);
        }
    }

    private static Map<String, Object> section(Map<String, Object> parent, String name) {
        Object child = parent.get(name);
        Map<String, Object> section = child == null
            ? new LinkedHashMap<>() : new LinkedHashMap<>(Utils.castToStringObjectMap(child));
        parent.put(name, section);
        return section;
    }
}
