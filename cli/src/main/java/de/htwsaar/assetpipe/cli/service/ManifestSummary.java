package de.htwsaar.assetpipe.cli.service;

import java.nio.file.Path;

/**
 * @param assets         Einträge im Manifest
 * @param versionedCopies neu angelegte fingerprinted Kopien
 * @param manifestFile   geschriebene Manifest-Datei, {@code null} wenn nichts geschrieben wurde
 */
public record ManifestSummary(int assets, int versionedCopies, Path manifestFile) {}
