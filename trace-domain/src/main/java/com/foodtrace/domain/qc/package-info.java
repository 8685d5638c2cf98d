/**
 * QC domain: gates and append-only inspection decisions that drive lot status and may hold a run.
 */
package com.foodtrace.domain.qc;
