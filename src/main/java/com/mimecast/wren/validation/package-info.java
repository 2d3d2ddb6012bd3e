/**
 * Validation pipeline.
 *
 * <p>{@link com.mimecast.wren.validation.Validator} owns the disposable membership index,
 * <br>the free provider set and the MX resolution cache.
 * <p>{@link com.mimecast.wren.validation.ConcurrentDispatcher} fans batches out across a bounded pool.
 *
 * @see com.mimecast.wren.validation.Options
 * @see com.mimecast.wren.validation.ValidationResult
 */
package com.mimecast.wren.validation;
