/**
 * Run statistics and the plain-text summary report.
 */
package io.github.yok.sentilink.report;
