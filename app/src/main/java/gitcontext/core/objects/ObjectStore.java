package gitcontext.core.objects;

import gitcontext.exceptions.GitException;

public interface ObjectStore {
    /**
     * Open a loose object for sequential decoding.
     *
     * @param sha The SHA-1 hash of the object, already validated
     * @return A reader positioned before the object header; the caller closes it
     * @throws gitcontext.exceptions.NotFoundException if no loose object file
     *                                                 exists for the hash
     */
    LooseObjectReader open(String sha) throws GitException;
}
