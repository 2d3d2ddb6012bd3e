/**
 * Configuration.
 *
 * <p>{@link com.mimecast.wren.config.ValidatorConfig} reads a JSON or JSON5 file or map
 * <br>and maps it onto {@link com.mimecast.wren.validation.Options} and bloom filter options.
 */
package com.mimecast.wren.config;
