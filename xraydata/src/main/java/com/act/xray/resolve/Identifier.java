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

import java.util.Objects;

/**
 * The normalized form of a caller-supplied identifier.  An identifier is exactly one of:
 * <ul>
 *   <li>{@link Form#VALUE}: a validated descriptor, matched on its physical quantities;</li>
 *   <li>{@link Form#LABEL}: a string to look up in the name, symbol or notation tables;</li>
 *   <li>{@link Form#UNSPECIFIED}: no identifier at all (only accepted for references).</li>
 * </ul>
 *
 * @param <T> the descriptor type of the entity kind
 */
public final class Identifier<T> {

  public enum Form {
    VALUE,
    LABEL,
    UNSPECIFIED,
  }

  private final EntityKind kind;
  private final Form form;
  private final T value;
  private final String label;

  private Identifier(EntityKind kind, Form form, T value, String label) {
    this.kind = kind;
    this.form = form;
    this.value = value;
    this.label = label;
  }

  public static <T> Identifier<T> ofValue(EntityKind kind, T value) {
    return new Identifier<>(kind, Form.VALUE, Objects.requireNonNull(value, "value"), null);
  }

  public static <T> Identifier<T> ofLabel(EntityKind kind, String label) {
    return new Identifier<>(kind, Form.LABEL, null, Objects.requireNonNull(label, "label"));
  }

  public static <T> Identifier<T> unspecified(EntityKind kind) {
    return new Identifier<>(kind, Form.UNSPECIFIED, null, null);
  }

  public EntityKind getKind() {
    return kind;
  }

  public Form getForm() {
    return form;
  }

  /**
   * @throws IllegalStateException if this identifier is not a {@link Form#VALUE}.
   */
  public T getValue() {
    if (form != Form.VALUE) {
      throw new IllegalStateException(String.format("%s identifier has no value", form));
    }
    return value;
  }

  /**
   * @throws IllegalStateException if this identifier is not a {@link Form#LABEL}.
   */
  public String getLabel() {
    if (form != Form.LABEL) {
      throw new IllegalStateException(String.format("%s identifier has no label", form));
    }
    return label;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Identifier<?> that = (Identifier<?>) o;
    return kind == that.kind && form == that.form && Objects.equals(value, that.value) &&
        Objects.equals(label, that.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, form, value, label);
  }

  @Override
  public String toString() {
    switch (form) {
      case VALUE:
        return String.format("Identifier(%s, %s)", kind, value);
      case LABEL:
        return String.format("Identifier(%s, '%s')", kind, label);
      default:
        return String.format("Identifier(%s, unspecified)", kind);
    }
  }
}
