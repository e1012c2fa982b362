/**
 * Trait schema registry.
 *
 * <p>The only package that reads protobuf wire bytes. Everything downstream
 * sees {@link com.questrail.traitstream.model.Envelope} records and
 * {@link com.questrail.traitstream.schema.WireMessage} views.</p>
 */
package com.questrail.traitstream.schema;
