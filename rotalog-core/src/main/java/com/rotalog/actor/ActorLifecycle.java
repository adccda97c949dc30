package com.rotalog.actor;

/**
 * Callbacks the {@link MailboxProcessor} drives on the actor's own thread.
 *
 * @param <M> The type of messages on the data channel
 * @param <C> The type of commands on the control channel
 */
public interface ActorLifecycle<M, C> {
    /** Called on the actor thread before either channel is serviced. */
    void preStart();

    /**
     * Called to dispatch a message from the data channel.
     *
     * @param message the message to be processed by the actor
     */
    void receive(M message);

    /**
     * Called to dispatch a command from the control channel.
     *
     * @param command the command to be processed by the actor
     */
    void onCommand(C command);

    /**
     * Called for each command still queued when the loop stops.
     *
     * @param command the command that will never be processed
     */
    void onDiscarded(C command);

    /** Called after mailbox processing ends. */
    void postStop();
}
