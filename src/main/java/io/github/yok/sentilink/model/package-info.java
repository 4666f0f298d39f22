/**
 * Data model shared by all pipeline stages: the {@link io.github.yok.sentilink.model.Tabular}
 * dataset, sentiment results and run statistics.
 */
package io.github.yok.sentilink.model;
