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

package com.act.xray.descriptor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A literature reference.  The BibTeX key is the identity of a reference; the remaining BibTeX fields are carried
 * along for display only.
 */
public final class Reference {

  public enum Field {
    AUTHOR("author"),
    YEAR("year"),
    TITLE("title"),
    TYPE("type"),
    BOOKTITLE("booktitle"),
    EDITOR("editor"),
    PAGES("pages"),
    EDITION("edition"),
    JOURNAL("journal"),
    SCHOOL("school"),
    ADDRESS("address"),
    URL("url"),
    NOTE("note"),
    NUMBER("number"),
    SERIES("series"),
    VOLUME("volume"),
    PUBLISHER("publisher"),
    ORGANIZATION("organization"),
    CHAPTER("chapter"),
    HOWPUBLISHED("howpublished"),
    DOI("doi"),
    ;

    private final String fieldName;

    Field(String fieldName) {
      this.fieldName = fieldName;
    }

    public String getFieldName() {
      return fieldName;
    }

    @Override
    public String toString() {
      return this.fieldName;
    }
  }

  private final String bibtexKey;
  private final Map<Field, String> fields;

  public Reference(String bibtexKey) {
    this(bibtexKey, Collections.emptyMap());
  }

  private Reference(String bibtexKey, Map<Field, String> fields) {
    if (bibtexKey == null || bibtexKey.isEmpty()) {
      throw new ValidationException("BibTeX key", "non-empty", bibtexKey);
    }
    this.bibtexKey = bibtexKey;
    this.fields = fields.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(fields));
  }

  public static Builder builder(String bibtexKey) {
    return new Builder(bibtexKey);
  }

  public String getBibtexKey() {
    return bibtexKey;
  }

  /**
   * @return the value of the BibTeX field, or null if it was not set.
   */
  public String getField(Field field) {
    return fields.get(field);
  }

  public Map<Field, String> getFields() {
    return fields;
  }

  public String getAuthor() {
    return fields.get(Field.AUTHOR);
  }

  public String getYear() {
    return fields.get(Field.YEAR);
  }

  public String getTitle() {
    return fields.get(Field.TITLE);
  }

  public String getDoi() {
    return fields.get(Field.DOI);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    return bibtexKey.equals(((Reference) o).bibtexKey);
  }

  @Override
  public int hashCode() {
    return bibtexKey.hashCode();
  }

  @Override
  public String toString() {
    return String.format("Reference(%s)", bibtexKey);
  }

  public static class Builder {
    private final String bibtexKey;
    private final Map<Field, String> fields = new EnumMap<>(Field.class);

    private Builder(String bibtexKey) {
      this.bibtexKey = bibtexKey;
    }

    public Builder set(Field field, String value) {
      if (value == null) {
        fields.remove(field);
      } else {
        fields.put(field, value);
      }
      return this;
    }

    public Builder author(String author) {
      return set(Field.AUTHOR, author);
    }

    public Builder year(String year) {
      return set(Field.YEAR, year);
    }

    public Builder title(String title) {
      return set(Field.TITLE, title);
    }

    public Builder journal(String journal) {
      return set(Field.JOURNAL, journal);
    }

    public Builder doi(String doi) {
      return set(Field.DOI, doi);
    }

    public Reference build() {
      return new Reference(bibtexKey, fields);
    }
  }
}
