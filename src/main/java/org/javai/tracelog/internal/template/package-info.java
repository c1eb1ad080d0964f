/**
 * Title templating internals: extracting the title from a callable's
 * documentation and substituting {@code {{param}}} placeholders.
 */
@org.springframework.lang.NonNullApi
package org.javai.tracelog.internal.template;
