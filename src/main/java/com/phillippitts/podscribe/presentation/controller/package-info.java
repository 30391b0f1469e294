/**
 * Read-only HTTP endpoints.
 */
package com.phillippitts.podscribe.presentation.controller;
