/**
 * Spring configuration: typed properties, bean selection, scheduling and startup validation.
 */
package com.phillippitts.podscribe.config;
