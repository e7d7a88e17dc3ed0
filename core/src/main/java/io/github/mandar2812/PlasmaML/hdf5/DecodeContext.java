package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.GlobalHeap;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * State required while decoding the elements of a single read operation.
 * Elements of variable-length types refer to objects stored elsewhere
 * in the file, so decoding them needs access to the file buffer.
 * Heap collections read during the lifetime of this object are retained
 * by it; a new context should be used for each read.
 *
 * @author   Mark Taylor
 * @since    14 Feb 2024
 */
public class DecodeContext {

    private final Buf buf_;
    private final Map<Long,GlobalHeap> heaps_;

    /**
     * Constructor.
     *
     * @param  buf  file buffer, or null if no heap access is available
     */
    public DecodeContext( Buf buf ) {
        buf_ = buf;
        heaps_ = new HashMap<Long,GlobalHeap>();
    }

    /**
     * Returns the file buffer.
     *
     * @return  buffer, may be null
     */
    public Buf getBuf() {
        return buf_;
    }

    /**
     * Returns the content of an object in a global heap collection.
     *
     * @param  collectionAddress  address of heap collection
     * @param  index   object index within collection
     * @return  object bytes
     */
    public byte[] readHeapObject( long collectionAddress, int index )
            throws IOException {
        if ( buf_ == null ) {
            throw new DataReadException( "No file access for "
                                       + "variable-length data" );
        }
        Long key = Long.valueOf( collectionAddress );
        GlobalHeap heap = heaps_.get( key );
        if ( heap == null ) {
            heap = GlobalHeap.readHeap( buf_, collectionAddress );
            heaps_.put( key, heap );
        }
        return heap.getObject( index );
    }
}
