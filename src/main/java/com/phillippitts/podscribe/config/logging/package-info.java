/**
 * Logging support: MDC scopes for pipeline work and the debug verbosity switch.
 */
package com.phillippitts.podscribe.config.logging;
