/**
 * Pipeline services: sources, selection, processing, scheduling, and their collaborators.
 */
package com.phillippitts.podscribe.service;
