/**
 * Pure java library for read-only access to HDF5 files.
 *
 * <p>Open a file with {@link io.github.mandar2812.PlasmaML.hdf5.Hdf5File},
 * then reach its groups and datasets by path.
 * {@link io.github.mandar2812.PlasmaML.hdf5.Dataset} reads whole arrays,
 * strided slices or chunk-sized blocks, decoded to java objects.
 *
 * <p>The package maps the file into an NIO buffer and reads structures
 * from it on demand, so opening a large file is cheap.
 * Compressed chunks are decoded with the deflate, shuffle, LZF and
 * Fletcher32 filters.
 *
 * <p>Files using the more recent storage structures (dense link and
 * attribute storage, fractal heaps, version 2 B-trees and the newer
 * chunk indexes) are only partly readable; where such a structure
 * stands in the way an
 * {@link io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException}
 * is thrown.
 */
package io.github.mandar2812.PlasmaML.hdf5;
