package com.famly.backend.repository;

import com.famly.backend.model.DiscussionThread;

import java.util.Optional;

/**
 * Repository for thread items in the FamlyTable.
 * List mutations are single conditional updates, so concurrent writers never lose each other's changes.
 */
public interface ThreadRepository {

    /**
     * The thread attributes that hold ordered id lists.
     */
    enum ListAttribute {
        CONTENT("content"),
        MEMBERS("members");

        private final String attributeName;

        ListAttribute(String attributeName) {
            this.attributeName = attributeName;
        }

        public String getAttributeName() {
            return attributeName;
        }
    }

    /**
     * Store a new thread. Fails if the key is already taken.
     */
    DiscussionThread create(DiscussionThread thread);

    Optional<DiscussionThread> findById(String threadId);

    /**
     * @throws com.famly.backend.exception.ThreadNotFoundException if the thread does not exist
     */
    void updateTitle(String threadId, String title);

    void delete(String threadId);

    /**
     * Append a value to the end of a list unless it is already there.
     *
     * @return true if the list changed
     * @throws com.famly.backend.exception.ThreadNotFoundException if the thread does not exist
     */
    boolean appendToList(String threadId, ListAttribute list, String value);

    /**
     * Remove a value from a list if present, keeping the order of the rest.
     *
     * @return true if the list changed
     * @throws com.famly.backend.exception.ThreadNotFoundException if the thread does not exist
     * @throws com.famly.backend.exception.VersionConflictException if concurrent writers kept moving the value
     */
    boolean removeFromList(String threadId, ListAttribute list, String value);
}
