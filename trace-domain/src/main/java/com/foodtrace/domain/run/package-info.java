/**
 * Run domain: production runs pinned to a published flow version and their step execution records.
 */
package com.foodtrace.domain.run;
