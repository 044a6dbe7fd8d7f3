/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Self-describing collection of named data variables, coordinate
 * variables and attributes that share dimension names.
 */
public class Dataset {

  private final Map<String, Variable> dataVariables;
  private final Map<String, Variable> coordinates;
  private final ObjectNode attributes;

  /**
   * @param dataVariables data variables by name, in output order
   * @param coordinates coordinate variables by name, in output order
   * @param attributes dataset attributes
   */
  public Dataset(Map<String, Variable> dataVariables,
    Map<String, Variable> coordinates, ObjectNode attributes)
  {
    this.dataVariables = Collections.unmodifiableMap(
      new LinkedHashMap<String, Variable>(dataVariables));
    this.coordinates = Collections.unmodifiableMap(
      new LinkedHashMap<String, Variable>(coordinates));
    this.attributes = attributes;
    getDimensions();
  }

  public Map<String, Variable> getDataVariables() {
    return dataVariables;
  }

  public Map<String, Variable> getCoordinates() {
    return coordinates;
  }

  public ObjectNode getAttributes() {
    return attributes;
  }

  /**
   * @param name variable name
   * @return data variable or coordinate with the given name, or null
   */
  public Variable getVariable(String name) {
    Variable v = dataVariables.get(name);
    return v != null ? v : coordinates.get(name);
  }

  /**
   * @return length of every dimension used by any variable, in order
   *         of first use (data variables before coordinates)
   * @throws IllegalStateException if two variables disagree on a length
   */
  public Map<String, Integer> getDimensions() {
    Map<String, Integer> sizes = new LinkedHashMap<String, Integer>();
    addDimensions(sizes, dataVariables);
    addDimensions(sizes, coordinates);
    return sizes;
  }

  /**
   * @param order trailing dimension order
   * @return dataset with every variable transposed
   * @see Variable#transpose(List)
   */
  public Dataset transpose(List<String> order) {
    Map<String, Variable> data = new LinkedHashMap<String, Variable>();
    for (Map.Entry<String, Variable> e : dataVariables.entrySet()) {
      data.put(e.getKey(), e.getValue().transpose(order));
    }
    Map<String, Variable> coords = new LinkedHashMap<String, Variable>();
    for (Map.Entry<String, Variable> e : coordinates.entrySet()) {
      coords.put(e.getKey(), e.getValue().transpose(order));
    }
    return new Dataset(data, coords, attributes);
  }

  private static void addDimensions(
    Map<String, Integer> sizes, Map<String, Variable> variables)
  {
    for (Map.Entry<String, Variable> e : variables.entrySet()) {
      Variable v = e.getValue();
      int[] shape = v.getShape();
      for (int i=0; i<shape.length; i++) {
        String dim = v.getDimensions().get(i);
        Integer known = sizes.get(dim);
        if (known == null) {
          sizes.put(dim, shape[i]);
        }
        else if (known != shape[i]) {
          throw new IllegalStateException("Variable " + e.getKey() +
            " has " + dim + " length " + shape[i] + ", expected " + known);
        }
      }
    }
  }

  @Override
  public String toString() {
    return "Dataset[dims=" + getDimensions() + ", data=" +
      dataVariables.keySet() + ", coords=" + coordinates.keySet() + "]";
  }

}
