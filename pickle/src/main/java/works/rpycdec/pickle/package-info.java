/**
 * A reader for Python's object reconstruction stream ("pickle"), protocols 0 through 5,
 * that never executes anything.
 * <p>
 * The main entry point is {@link works.rpycdec.pickle.Unpickler}.
 * Every class reference in the stream is resolved through an {@link works.rpycdec.pickle.AllowList};
 * allowed standard types become native Java values, and classes from friendly namespaces
 * become {@link works.rpycdec.pickle.values.PickleObject generic records}
 * for a later pass to interpret.
 */
package works.rpycdec.pickle;
