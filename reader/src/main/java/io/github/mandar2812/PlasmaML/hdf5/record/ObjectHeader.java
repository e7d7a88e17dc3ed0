package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The header of an HDF5 object (group, dataset or committed datatype),
 * which is an ordered list of messages.
 * Messages may be spread over several blocks linked by
 * continuation messages; this class gathers them all.
 *
 * <p>Both version 1 headers and version 2 (<code>OHDR</code>) headers
 * are read.  Version 2 checksums are not verified.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public class ObjectHeader {

    private final long address_;
    private final int version_;
    private final List<Message> messages_;

    private static final String V2_SIGNATURE = "OHDR";
    private static final String CONTINUATION_SIGNATURE = "OCHK";
    private static final Logger logger_ =
        Logger.getLogger( ObjectHeader.class.getName() );

    /**
     * Constructor.
     *
     * @param  address  header address
     * @param  version  header format version
     * @param  messages  all messages in order
     */
    private ObjectHeader( long address, int version, List<Message> messages ) {
        address_ = address;
        version_ = version;
        messages_ = Collections.unmodifiableList( messages );
    }

    /**
     * Returns the address of this header.
     *
     * @return  header address
     */
    public long getAddress() {
        return address_;
    }

    /**
     * Returns the header format version.
     *
     * @return  1 or 2
     */
    public int getVersion() {
        return version_;
    }

    /**
     * Returns all the messages in this header, in order.
     *
     * @return  message list
     */
    public List<Message> getMessages() {
        return messages_;
    }

    /**
     * Returns all the messages of a given class.
     *
     * @param  clazz  message class
     * @return  matching messages in header order
     */
    public <M extends Message> List<M> getMessages( Class<M> clazz ) {
        List<M> list = new ArrayList<M>();
        for ( Message msg : messages_ ) {
            if ( clazz.isInstance( msg ) ) {
                list.add( clazz.cast( msg ) );
            }
        }
        return list;
    }

    /**
     * Returns the first message of a given class.
     *
     * @param  clazz  message class
     * @return  message, or null if there is none
     */
    public <M extends Message> M getMessage( Class<M> clazz ) {
        for ( Message msg : messages_ ) {
            if ( clazz.isInstance( msg ) ) {
                return clazz.cast( msg );
            }
        }
        return null;
    }

    /**
     * Indicates whether this header contains a message of a given type.
     *
     * @param  type  message type
     * @return  true iff present
     */
    public boolean hasMessage( MessageType type ) {
        for ( Message msg : messages_ ) {
            if ( msg.getMessageType() == type ) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads an object header from a buffer.
     *
     * @param  buf  buffer
     * @param  address  header address
     * @param  msgFact  message factory
     * @return  header
     */
    public static ObjectHeader readHeader( Buf buf, long address,
                                           MessageFactory msgFact )
            throws IOException {
        if ( address == Buf.UNDEFINED_ADDRESS || address < 0
             || address >= buf.getLength() ) {
            throw new Hdf5FormatException( "Object header address 0x"
                                         + Long.toHexString( address )
                                         + " outside file" );
        }
        Pointer ptr = new Pointer( address );
        int version1 = buf.readUnsignedByte( ptr );
        ObjectHeader header;
        if ( version1 == 1 ) {
            header = readV1Header( buf, address, msgFact );
        }
        else if ( V2_SIGNATURE.equals( buf.readAsciiString( new Pointer(
                                                                address ),
                                                            4 ) ) ) {
            header = readV2Header( buf, address, msgFact );
        }
        else {
            throw new Hdf5FormatException( "No object header at 0x"
                                         + Long.toHexString( address ) );
        }
        logger_.config( "Object header v" + header.version_ + " at 0x"
                      + Long.toHexString( address ) + ": "
                      + header.messages_ );
        return header;
    }

    /**
     * Reads a version 1 header.
     */
    private static ObjectHeader readV1Header( Buf buf, long address,
                                              MessageFactory msgFact )
            throws IOException {
        Pointer ptr = new Pointer( address + 2 );
        int nmsg = buf.readUnsignedShort( ptr );
        ptr.skip( 4 );  // reference count
        long headSize = buf.readUnsignedInt( ptr );
        long start = address + 16;
        List<Message> messages = new ArrayList<Message>();
        LinkedList<long[]> blocks = new LinkedList<long[]>();
        blocks.add( new long[] { start, start + headSize } );
        Set<Long> seen = new HashSet<Long>();
        while ( ! blocks.isEmpty() && messages.size() < nmsg ) {
            long[] block = blocks.removeFirst();
            checkBlock( buf, block, seen );
            Pointer mptr = new Pointer( block[ 0 ] );
            while ( mptr.get() + 8 <= block[ 1 ] && messages.size() < nmsg ) {
                int type = buf.readUnsignedShort( mptr );
                int size = buf.readUnsignedShort( mptr );
                int flags = buf.readUnsignedByte( mptr );
                mptr.skip( 3 );
                Message msg = readMessage( buf, mptr, block[ 1 ], type, size,
                                           flags, msgFact );
                addMessage( msg, messages, blocks, 0 );
            }
        }
        if ( messages.size() < nmsg ) {
            logger_.warning( "Object header at 0x"
                           + Long.toHexString( address ) + " has "
                           + messages.size() + " messages, expected "
                           + nmsg );
        }
        return new ObjectHeader( address, 1, messages );
    }

    /**
     * Reads a version 2 header.
     */
    private static ObjectHeader readV2Header( Buf buf, long address,
                                              MessageFactory msgFact )
            throws IOException {
        Pointer ptr = new Pointer( address + 4 );
        int version = buf.readUnsignedByte( ptr );
        if ( version != 2 ) {
            throw new UnsupportedFeatureException( "object header version "
                                                 + version, null );
        }
        int hflags = buf.readUnsignedByte( ptr );
        if ( Message.hasBit( hflags, 5 ) ) {
            ptr.skip( 16 );  // access, modification, change, birth times
        }
        if ( Message.hasBit( hflags, 4 ) ) {
            ptr.skip( 4 );   // max compact and min dense attribute counts
        }
        long chunkSize = buf.readUnsigned( ptr, 1 << ( hflags & 0x3 ) );
        int msgHeadSize = Message.hasBit( hflags, 2 ) ? 6 : 4;
        List<Message> messages = new ArrayList<Message>();
        LinkedList<long[]> blocks = new LinkedList<long[]>();
        blocks.add( new long[] { ptr.get(), ptr.get() + chunkSize } );
        Set<Long> seen = new HashSet<Long>();
        boolean first = true;
        while ( ! blocks.isEmpty() ) {
            long[] block = blocks.removeFirst();
            checkBlock( buf, block, seen );
            Pointer mptr = new Pointer( block[ 0 ] );
            if ( ! first ) {
                String sig = buf.readAsciiString( mptr, 4 );
                if ( ! CONTINUATION_SIGNATURE.equals( sig ) ) {
                    throw new Hdf5FormatException( "Bad continuation block "
                                                 + "signature \"" + sig
                                                 + "\" at 0x"
                                                 + Long.toHexString(
                                                       block[ 0 ] ) );
                }
            }
            first = false;

            // Whatever is left after the last message that is too small
            // to hold a message header is a gap.
            while ( mptr.get() + msgHeadSize <= block[ 1 ] ) {
                int type = buf.readUnsignedByte( mptr );
                int size = buf.readUnsignedShort( mptr );
                int flags = buf.readUnsignedByte( mptr );
                if ( msgHeadSize == 6 ) {
                    mptr.skip( 2 );  // creation order
                }
                Message msg = readMessage( buf, mptr, block[ 1 ], type, size,
                                           flags, msgFact );
                addMessage( msg, messages, blocks, 4 );
            }
        }
        return new ObjectHeader( address, 2, messages );
    }

    /**
     * Reads one message body and advances the pointer past it.
     */
    private static Message readMessage( Buf buf, Pointer ptr, long blockEnd,
                                        int type, int size, int flags,
                                        MessageFactory msgFact )
            throws IOException {
        long start = ptr.get();
        if ( start + size > blockEnd ) {
            throw new Hdf5FormatException( "Header message at 0x"
                                         + Long.toHexString( start )
                                         + " overruns its block" );
        }
        MessagePlan plan = new MessagePlan( start, size, type, flags, buf );
        Message msg = msgFact.createMessage( plan );
        ptr.set( start + size );
        return msg;
    }

    /**
     * Adds a message to the list, queueing any continuation block
     * it points to.
     *
     * @param  msg  message
     * @param  messages  message list to extend
     * @param  blocks   queue of (start, end) blocks still to read
     * @param  suffix   bytes at end of continuation block after messages
     */
    private static void addMessage( Message msg, List<Message> messages,
                                    LinkedList<long[]> blocks, int suffix ) {
        messages.add( msg );
        if ( msg instanceof ContinuationMessage ) {
            ContinuationMessage cont = (ContinuationMessage) msg;
            long start = cont.blockAddress;
            blocks.add( new long[] { start,
                                     start + cont.blockLength - suffix } );
        }
    }

    /**
     * Checks a header block is inside the file and has not been read
     * already.
     */
    private static void checkBlock( Buf buf, long[] block, Set<Long> seen )
            throws Hdf5FormatException {
        if ( block[ 0 ] < 0 || block[ 1 ] > buf.getLength()
             || block[ 1 ] < block[ 0 ] ) {
            throw new Hdf5FormatException( "Header block 0x"
                                         + Long.toHexString( block[ 0 ] )
                                         + " outside file" );
        }
        if ( ! seen.add( Long.valueOf( block[ 0 ] ) ) ) {
            throw new Hdf5FormatException( "Header continuation loop at 0x"
                                         + Long.toHexString( block[ 0 ] ) );
        }
    }
}
