/**
 * Error kinds and structured error values.
 * <p>Per-address rejections travel as {@link com.mimecast.wren.error.ValidationError} values on the result.
 * <br>Failing library calls throw {@link com.mimecast.wren.error.ValidatorException}.
 */
package com.mimecast.wren.error;
