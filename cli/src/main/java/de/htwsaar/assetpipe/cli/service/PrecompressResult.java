package de.htwsaar.assetpipe.cli.service;

/**
 * Zähler eines {@code precompress}-Laufs.
 *
 * @param scanned   komprimierbare Quelldateien
 * @param brotli    neu geschriebene {@code .br}-Dateien
 * @param gzip      neu geschriebene {@code .gz}-Dateien
 * @param upToDate  übersprungene, bereits aktuelle Varianten
 */
public record PrecompressResult(int scanned, int brotli, int gzip, int upToDate) {}
