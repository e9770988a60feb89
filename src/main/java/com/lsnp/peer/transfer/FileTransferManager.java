package com.lsnp.peer.transfer;

import com.lsnp.peer.auth.TokenIssuer;
import com.lsnp.peer.auth.TokenScope;
import com.lsnp.peer.net.MessageRouter;
import com.lsnp.peer.net.PeerDirectory;
import com.lsnp.peer.net.Transport;
import com.lsnp.peer.protocol.Fields;
import com.lsnp.peer.protocol.Message;
import com.lsnp.peer.protocol.MessageException;
import com.lsnp.peer.protocol.MessageType;
import com.lsnp.peer.transport.ReliableSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.net.InetAddress;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chunked file transfer in both directions.
 *
 * Sender flow: register transfer → FILE_OFFER (reliable) → wait for FILE_ACCEPT →
 * stream FILE_CHUNKs (reliable, one retry each) → wait for FILE_RECEIVED.
 * Each outgoing transfer runs on its own daemon thread.
 *
 * Receiver flow: FILE_OFFER is held until {@link #acceptOffer} or {@link #rejectOffer};
 * chunks are collected by index and the file is written once all have arrived.
 */
public class FileTransferManager {

    private static final Logger log = LoggerFactory.getLogger(FileTransferManager.class);

    public static final int DEFAULT_CHUNK_SIZE = 1024;
    public static final long DEFAULT_OFFER_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_RECEIPT_TIMEOUT_MS = 120_000;

    /** Transfer tuning. */
    public record Settings(Path downloadDir, int chunkSize, long offerTimeoutMs, long receiptTimeoutMs) {

        public static Settings defaults(Path downloadDir) {
            return new Settings(downloadDir, DEFAULT_CHUNK_SIZE, DEFAULT_OFFER_TIMEOUT_MS, DEFAULT_RECEIPT_TIMEOUT_MS);
        }
    }

    private final TokenIssuer tokens;
    private final ReliableSender sender;
    private final Transport transport;
    private final PeerDirectory directory;
    private final TransferListener listener;
    private final Settings settings;
    private final String localIdentity;

    private final Map<String, OutgoingTransfer> outgoing = new ConcurrentHashMap<>();
    private final Map<String, FileOffer> offers = new ConcurrentHashMap<>();
    private final Map<String, IncomingTransfer> incoming = new ConcurrentHashMap<>();

    public FileTransferManager(TokenIssuer tokens, ReliableSender sender, Transport transport,
                               PeerDirectory directory, TransferListener listener, Settings settings) {
        this.tokens = tokens;
        this.sender = sender;
        this.transport = transport;
        this.directory = directory;
        this.listener = listener;
        this.settings = settings;
        this.localIdentity = tokens.identity();
    }

    public void register(MessageRouter router) {
        router.addHandler(MessageType.FILE_OFFER, this::handleOffer);
        router.addHandler(MessageType.FILE_ACCEPT, msg -> handleDecision(msg, true));
        router.addHandler(MessageType.FILE_REJECT, msg -> handleDecision(msg, false));
        router.addHandler(MessageType.FILE_CHUNK, this::handleChunk);
        router.addHandler(MessageType.FILE_RECEIVED, this::handleReceived);
    }

    /**
     * Offer a file to {@code recipient}. Blocks until the offer is acknowledged, then
     * hands the transfer to a background thread.
     *
     * @return the transfer; its state is TIMED_OUT if the offer was never acknowledged
     */
    public OutgoingTransfer offer(String recipient, Path file, String description) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("not a regular file: " + file);
        }
        long size = Files.size(file);
        int totalChunks = totalChunks(size, settings.chunkSize());
        String fileId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        String filename = file.getFileName().toString();

        OutgoingTransfer transfer = new OutgoingTransfer(fileId, recipient, file, size, totalChunks);
        outgoing.put(fileId, transfer);

        FileOffer offer = new FileOffer(localIdentity, recipient, fileId, filename, size, guessType(file),
                totalChunks, settings.chunkSize(), description == null ? "" : description,
                Message.newMessageId(), tokens.tokenFor(TokenScope.FILE));
        log.info("Offering {} ({} bytes, {} chunks) to {} as {}", filename, size, totalChunks, recipient, fileId);

        if (!sender.sendReliable(offer.toMessage(nowSeconds()), recipient)) {
            log.warn("Offer {} to {} was not acknowledged", fileId, recipient);
            finish(transfer, TransferState.TIMED_OUT);
            return transfer;
        }

        Thread worker = new Thread(() -> run(transfer), "file-transfer-" + fileId);
        worker.setDaemon(true);
        worker.start();
        return transfer;
    }

    private void run(OutgoingTransfer transfer) {
        try {
            if (!transfer.awaitDecision(settings.offerTimeoutMs())) {
                log.warn("No response to offer {} within {}ms", transfer.fileId(), settings.offerTimeoutMs());
                finish(transfer, TransferState.TIMED_OUT);
                return;
            }
            if (!transfer.accepted()) {
                log.info("Offer {} rejected by {}", transfer.fileId(), transfer.recipient());
                finish(transfer, TransferState.REJECTED);
                return;
            }

            transfer.setState(TransferState.ACCEPTED);
            log.info("Offer {} accepted, sending {} chunks", transfer.fileId(), transfer.totalChunks());
            transfer.setState(TransferState.SENDING);
            streamChunks(transfer);
            transfer.setState(TransferState.SENT);

            if (transfer.awaitReceived(settings.receiptTimeoutMs())) {
                log.info("Transfer {} confirmed by {}", transfer.fileId(), transfer.recipient());
                finish(transfer, TransferState.COMPLETED);
            } else {
                log.warn("No FILE_RECEIVED for {} within {}ms", transfer.fileId(), settings.receiptTimeoutMs());
                finish(transfer, TransferState.EXPIRED);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(transfer, TransferState.EXPIRED);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", transfer.path(), e.getMessage());
            finish(transfer, TransferState.FAILED);
        }
    }

    private void streamChunks(OutgoingTransfer transfer) throws IOException {
        int chunkSize = settings.chunkSize();
        String token = tokens.tokenFor(TokenScope.FILE);
        try (RandomAccessFile raf = new RandomAccessFile(transfer.path().toFile(), "r")) {
            byte[] buf = new byte[chunkSize];
            for (int index = 0; index < transfer.totalChunks(); index++) {
                long offset = (long) index * chunkSize;
                int toRead = (int) Math.max(0, Math.min(chunkSize, transfer.fileSize() - offset));
                raf.seek(offset);
                raf.readFully(buf, 0, toRead);

                FileChunk chunk = new FileChunk(localIdentity, transfer.recipient(), transfer.fileId(), index,
                        transfer.totalChunks(), Arrays.copyOf(buf, toRead), Message.newMessageId(), token);
                Message msg = chunk.toMessage(nowSeconds());
                if (sender.sendReliable(msg, transfer.recipient())) {
                    transfer.chunkSent();
                } else if (sender.sendReliable(msg, transfer.recipient())) {
                    log.debug("Chunk {} of {} delivered on retry", index, transfer.fileId());
                    transfer.chunkSent();
                } else {
                    log.warn("Chunk {} of {} not acknowledged, continuing", index, transfer.fileId());
                }
            }
        }
    }

    private void finish(OutgoingTransfer transfer, TransferState state) {
        transfer.setState(state);
        outgoing.remove(transfer.fileId());
        listener.onTransferFinished(transfer);
    }

    /** Accept a pending offer and start collecting its chunks. */
    public boolean acceptOffer(String fileId) {
        FileOffer offer = offers.remove(fileId);
        if (offer == null) {
            return false;
        }
        incoming.put(fileId, new IncomingTransfer(offer));
        log.info("Accepting {} ({} bytes) from {}", offer.filename(), offer.fileSize(), offer.from());
        sendDecision(offer, MessageType.FILE_ACCEPT);
        return true;
    }

    public boolean rejectOffer(String fileId) {
        FileOffer offer = offers.remove(fileId);
        if (offer == null) {
            return false;
        }
        log.info("Rejecting {} from {}", offer.filename(), offer.from());
        sendDecision(offer, MessageType.FILE_REJECT);
        return true;
    }

    private void sendDecision(FileOffer offer, MessageType type) {
        Message msg = Message.builder(type)
                .field(Fields.FROM, localIdentity)
                .field(Fields.TO, offer.from())
                .field(Fields.FILE_ID, offer.fileId())
                .field(Fields.TIMESTAMP, nowSeconds())
                .field(Fields.TOKEN, tokens.tokenFor(TokenScope.FILE))
                .build();
        sendTo(offer.from(), msg);
    }

    void handleOffer(Message msg) {
        FileOffer offer;
        try {
            offer = FileOffer.from(msg);
        } catch (MessageException e) {
            log.debug("Ignoring bad offer: {}", e.getMessage());
            return;
        }
        if (!localIdentity.equals(offer.to())) {
            return;
        }
        if (offers.containsKey(offer.fileId()) || incoming.containsKey(offer.fileId())) {
            log.debug("Ignoring repeated offer {}", offer.fileId());
            return;
        }
        offers.put(offer.fileId(), offer);
        log.info("{} offers {} ({} bytes) as {}", offer.from(), offer.filename(), offer.fileSize(), offer.fileId());
        listener.onFileOffer(offer);
    }

    private void handleDecision(Message msg, boolean accept) {
        String fileId = msg.get(Fields.FILE_ID);
        OutgoingTransfer transfer = outgoing.get(fileId);
        if (transfer == null) {
            log.debug("{} for unknown transfer {}", msg.type(), fileId);
            return;
        }
        if (!transfer.recipient().equals(msg.get(Fields.FROM))) {
            log.debug("Ignoring {} for {} from {}", msg.type(), fileId, msg.get(Fields.FROM));
            return;
        }
        transfer.decide(accept);
    }

    void handleChunk(Message msg) {
        FileChunk chunk;
        try {
            chunk = FileChunk.from(msg);
        } catch (MessageException e) {
            log.debug("Ignoring bad chunk: {}", e.getMessage());
            return;
        }
        IncomingTransfer transfer = incoming.get(chunk.fileId());
        if (transfer == null) {
            log.debug("Chunk {} for unknown transfer {}", chunk.chunkIndex(), chunk.fileId());
            return;
        }
        FileOffer offer = transfer.offer();
        if (!offer.from().equals(chunk.from())) {
            log.debug("Ignoring chunk for {} from {}", chunk.fileId(), chunk.from());
            return;
        }
        if (chunk.totalChunks() != offer.totalChunks()) {
            log.debug("Ignoring chunk for {} claiming {} chunks, offer had {}",
                    chunk.fileId(), chunk.totalChunks(), offer.totalChunks());
            return;
        }
        if (!transfer.store(chunk.chunkIndex(), chunk.data())) {
            return;
        }
        if (!incoming.remove(chunk.fileId(), transfer)) {
            return;
        }

        byte[] content = transfer.assemble();
        if (content.length != offer.fileSize()) {
            log.warn("Discarding {} from {}: assembled {} bytes, offer declared {}",
                    offer.filename(), offer.from(), content.length, offer.fileSize());
            return;
        }
        Path saved;
        try {
            saved = save(offer.filename(), content);
        } catch (IOException e) {
            log.error("Failed to write {}: {}", offer.filename(), e.getMessage());
            return;
        }
        log.info("Received {} from {} into {}", offer.filename(), offer.from(), saved);

        Message received = Message.builder(MessageType.FILE_RECEIVED)
                .field(Fields.FROM, localIdentity)
                .field(Fields.TO, offer.from())
                .field(Fields.FILE_ID, offer.fileId())
                .field(Fields.STATUS, "COMPLETE")
                .field(Fields.TIMESTAMP, nowSeconds())
                .build();
        sendTo(offer.from(), received);
        listener.onFileReceived(offer, saved);
    }

    private void handleReceived(Message msg) {
        String fileId = msg.get(Fields.FILE_ID);
        OutgoingTransfer transfer = outgoing.get(fileId);
        if (transfer == null) {
            log.debug("FILE_RECEIVED for unknown transfer {}", fileId);
            return;
        }
        if (transfer.recipient().equals(msg.get(Fields.FROM))) {
            transfer.markReceived();
        }
    }

    private Path save(String filename, byte[] content) throws IOException {
        Files.createDirectories(settings.downloadDir());
        String safeName = sanitize(filename);
        Path target = settings.downloadDir().resolve(safeName);
        if (Files.exists(target)) {
            target = settings.downloadDir().resolve(nowSeconds() + "_" + safeName);
        }
        Files.write(target, content);
        return target;
    }

    private void sendTo(String identity, Message msg) {
        InetAddress address = directory.resolve(identity);
        if (address == null) {
            log.warn("Cannot resolve address for {}, dropping {}", identity, msg.type());
            return;
        }
        try {
            transport.send(msg, address);
        } catch (IOException e) {
            log.warn("Failed to send {} to {}: {}", msg.type(), identity, e.getMessage());
        }
    }

    public OutgoingTransfer outgoing(String fileId) {
        return outgoing.get(fileId);
    }

    public List<FileOffer> pendingOffers() {
        return new ArrayList<>(offers.values());
    }

    public IncomingTransfer incoming(String fileId) {
        return incoming.get(fileId);
    }

    public List<OutgoingTransfer> outgoingTransfers() {
        return new ArrayList<>(outgoing.values());
    }

    static int totalChunks(long size, int chunkSize) {
        if (size == 0) {
            return 1;
        }
        return (int) ((size + chunkSize - 1) / chunkSize);
    }

    static String sanitize(String filename) {
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return "download.bin";
        }
        return name;
    }

    private static String guessType(Path file) {
        String type = URLConnection.guessContentTypeFromName(file.getFileName().toString());
        return type == null ? "application/octet-stream" : type;
    }

    private static long nowSeconds() {
        return System.currentTimeMillis() / 1000;
    }
}
