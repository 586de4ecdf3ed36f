/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.act.xray.resolve;

import com.act.xray.descriptor.Reference;
import com.act.xray.sql.Schema;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The reference to use for each property table when a lookup does not name one.  Loaded from a JSON object mapping
 * property table names to BibTeX keys, e.g. {@code {"xray_transition_energy": "deslattes2003"}}.
 */
public class ReferencePreferences {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReferencePreferences.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final ReferencePreferences NONE = new ReferencePreferences(Collections.emptyMap());

  private final Map<String, Reference> defaults;

  private ReferencePreferences(Map<String, Reference> defaults) {
    this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ReferencePreferences fromJson(InputStream in) throws IOException {
    Map<String, String> keys = OBJECT_MAPPER.readValue(in, new TypeReference<Map<String, String>>() {});
    return fromKeys(keys);
  }

  public static ReferencePreferences fromJsonFile(File file) throws IOException {
    Map<String, String> keys = OBJECT_MAPPER.readValue(file, new TypeReference<Map<String, String>>() {});
    LOGGER.info("Read %d default reference(s) from %s", keys.size(), file.getAbsolutePath());
    return fromKeys(keys);
  }

  private static ReferencePreferences fromKeys(Map<String, String> keys) {
    Builder builder = builder();
    for (Map.Entry<String, String> entry : keys.entrySet()) {
      builder.setDefault(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  /**
   * @return the default reference of the property table, or null if none is configured.
   * @throws IllegalArgumentException if {@code property} is not a property table.
   */
  public Reference getDefault(String property) {
    checkProperty(property);
    return defaults.get(property);
  }

  public Map<String, Reference> getDefaults() {
    return defaults;
  }

  private static void checkProperty(String property) {
    if (!Schema.PROPERTY_TABLES.contains(property)) {
      throw new IllegalArgumentException(String.format("Unknown property: %s", property));
    }
  }

  public static class Builder {
    private final Map<String, Reference> defaults = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder setDefault(String property, String bibtexKey) {
      return setDefault(property, bibtexKey == null ? null : new Reference(bibtexKey));
    }

    /**
     * Sets the default reference of a property table; a null reference clears it.
     */
    public Builder setDefault(String property, Reference reference) {
      checkProperty(property);
      if (reference == null) {
        defaults.remove(property);
      } else {
        defaults.put(property, reference);
      }
      return this;
    }

    public ReferencePreferences build() {
      return new ReferencePreferences(defaults);
    }
  }
}
