package com.lsnp.peer.transfer;

import java.nio.file.Path;

/**
 * File transfer notifications.
 */
public interface TransferListener {

    default void onFileOffer(FileOffer offer) {}

    default void onFileReceived(FileOffer offer, Path savedTo) {}

    /** An outgoing transfer reached a terminal state. */
    default void onTransferFinished(OutgoingTransfer transfer) {}
}
