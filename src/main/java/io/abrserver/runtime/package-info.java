/**
 * Process wiring.
 *
 * <p>{@link io.abrserver.runtime.AbrServerRuntime} builds every component from the server root and its
 * settings and hands the same instances to the web layer and the CLI.
 */
package io.abrserver.runtime;
