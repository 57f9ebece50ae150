/*
 * Copyright (c) 2011, Cloudera, Inc. All Rights Reserved.
 *
 * Cloudera, Inc. licenses this file to you under the Apache License,
 * Version 2.0 (the "License"). You may not use this file except in
 * compliance with the License. You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * This software is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
 * CONDITIONS OF ANY KIND, either express or implied. See the License for
 * the specific language governing permissions and limitations under the
 * License.
 */
package com.cloudera.xml2code.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.avro.JsonProperties;
import org.apache.avro.Schema;

import com.cloudera.xml2code.inference.ContentType;
import com.cloudera.xml2code.inference.EnumVariants;
import com.cloudera.xml2code.inference.InferredModel;
import com.cloudera.xml2code.inference.InferredModel.AttributeField;
import com.cloudera.xml2code.inference.InferredModel.AttributeType;
import com.cloudera.xml2code.inference.InferredModel.ChildField;
import com.cloudera.xml2code.inference.InferredModel.ElementType;

/*********************************************************
 * AvroSchemaEmitter describes an InferredModel as an Avro schema: one
 * record per element type, with the same fields, shapes and enums as
 * the generated Java reader.  Optional fields become unions with null,
 * repeated children become arrays and recursive children refer back
 * to their record by name.
 *********************************************************/
public class AvroSchemaEmitter {
  private final InferredModel model;
  private final String namespace;
  private final Map<ElementType, Schema> records = new HashMap<ElementType, Schema>();
  private final Map<String, Schema> enums = new HashMap<String, Schema>();

  public AvroSchemaEmitter(InferredModel model, String namespace) {
    this.model = model;
    this.namespace = (namespace == null) ? "" : namespace;
  }

  /**
   * The schema of the root record.
   */
  public Schema emit() {
    records.clear();
    enums.clear();
    // Create every record first so that fields can refer to any of them
    for (ElementType element: model.getElements()) {
      records.put(element, Schema.createRecord(element.getTypeName(), "The <" + element.getXmlName() + "> element", namespace, false));
    }
    for (ElementType element: model.getElements()) {
      List<Schema.Field> fields = new ArrayList<Schema.Field>();
      for (AttributeField field: element.getAttributeFields()) {
        AttributeType attribute = field.getType();
        Schema schema = scalarSchema(attribute.getContentType(), attribute.getEnumName(), attribute.getVariants());
        fields.add(field(field.getFieldName(), schema, "Attribute " + attribute.getXmlName(), field.getShape().isOptional()));
      }
      for (ChildField field: element.getChildFields()) {
        String doc = "Child element " + field.getXmlName();
        if (field.isFlag()) {
          fields.add(new Schema.Field(field.getFieldName(), Schema.create(Schema.Type.BOOLEAN), doc, Boolean.FALSE));
        } else if (field.getShape().isVector()) {
          fields.add(new Schema.Field(field.getFieldName(), Schema.createArray(records.get(field.getChildType())), doc));
        } else {
          fields.add(field(field.getFieldName(), records.get(field.getChildType()), doc, field.getShape().isOptional()));
        }
      }
      if (element.hasContent()) {
        Schema schema = scalarSchema(element.getContentType(), element.getContentEnumName(), element.getContentVariants());
        fields.add(field("content", schema, "Text content", ! element.isContentRequired()));
      }
      records.get(element).setFields(fields);
    }
    return records.get(model.getRoot());
  }

  Schema.Field field(String name, Schema schema, String doc, boolean optional) {
    if (optional) {
      Schema union = Schema.createUnion(Arrays.asList(Schema.create(Schema.Type.NULL), schema));
      return new Schema.Field(name, union, doc, JsonProperties.NULL_VALUE);
    }
    return new Schema.Field(name, schema, doc);
  }

  Schema scalarSchema(ContentType type, String enumName, EnumVariants variants) {
    switch (type) {
    case BOOL:
      return Schema.create(Schema.Type.BOOLEAN);
    case UINT:
    case INT:
      return Schema.create(Schema.Type.LONG);
    case FLOAT:
      return Schema.create(Schema.Type.DOUBLE);
    case ENUM: {
      Schema schema = enums.get(enumName);
      if (schema == null) {
        schema = Schema.createEnum(enumName, null, namespace, variants.getConstants());
        enums.put(enumName, schema);
      }
      return schema;
    }
    default:
      return Schema.create(Schema.Type.STRING);
    }
  }
}
