package io.intellixity.relata.persistence.cql.relation;

/**
 * Column pointing at a row of another model.\n
 *
 * @param <J> value handed to Java code on read\n
 * @param <D> validated value, ready to be marshalled for the driver\n
 */
public interface ReferenceColumn<J, D> {
  RelationConfig config();

  /** CQL type of the backing column. */
  String cqlType();

  D validate(Object value);

  /** Driver-ready value. */
  Object toDatabase(Object value);

  J toJava(Object raw);
}
