package io.github.mandar2812.PlasmaML.hdf5.record;

import java.util.Arrays;

/**
 * Location and storage details of one stored chunk.
 *
 * @author   Mark Taylor
 * @since    17 Feb 2024
 */
public class ChunkRecord {

    private final long[] coord_;
    private final long address_;
    private final long size_;
    private final int filterMask_;

    /**
     * Constructor.
     *
     * @param  coord  chunk grid coordinate
     * @param  address  address of stored chunk bytes
     * @param  size   number of stored bytes
     * @param  filterMask  mask of filters skipped for this chunk
     */
    public ChunkRecord( long[] coord, long address, long size,
                        int filterMask ) {
        coord_ = coord.clone();
        address_ = address;
        size_ = size;
        filterMask_ = filterMask;
    }

    /**
     * Returns the position of this chunk in the chunk grid.
     *
     * @return  chunk indices, one per dataset dimension
     */
    public long[] getCoord() {
        return coord_.clone();
    }

    /**
     * Returns the address of the stored chunk.
     *
     * @return  address
     */
    public long getAddress() {
        return address_;
    }

    /**
     * Returns the stored size of the chunk.
     *
     * @return  size in bytes
     */
    public long getSize() {
        return size_;
    }

    /**
     * Returns the filter mask for this chunk.
     *
     * @return  mask; bit i set means filter i was skipped
     */
    public int getFilterMask() {
        return filterMask_;
    }

    @Override
    public String toString() {
        return "chunk" + Arrays.toString( coord_ ) + "@0x"
             + Long.toHexString( address_ ) + "+" + size_;
    }
}
