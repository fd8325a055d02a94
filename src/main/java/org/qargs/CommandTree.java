package org.qargs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.log4j.Logger;
import org.qargs.validate.ArgumentDefinitionException;
import org.qargs.validate.ArgumentSetValidation;

/**
 * The resolved, validated hierarchy of a root command and its subcommands. A tree is built once and may then be used for any number of
 * parses, concurrently.
 */
public final class CommandTree {
	private static final Logger log = Logger.getLogger(CommandTree.class);

	/** A command in the tree */
	public static final class Node {
		private final CommandDefinition theDefinition;
		private final Node theParent;
		private final List<Node> theChildren;
		private final ArgumentMatcher theMatcher;
		private Node theDefaultChild;

		Node(CommandDefinition definition, Node parent) {
			theDefinition = definition;
			theParent = parent;
			theChildren = new ArrayList<>();
			theMatcher = new ArgumentMatcher(definition.getArguments());
		}

		/** @return The command's definition */
		public CommandDefinition getDefinition() {
			return theDefinition;
		}

		/** @return The command's name */
		public String getName() {
			return theDefinition.getName();
		}

		/** @return The parent command, or null for the root */
		public Node getParent() {
			return theParent;
		}

		/** @return The subcommands */
		public List<Node> getChildren() {
			return Collections.unmodifiableList(theChildren);
		}

		/** @return The subcommand used when none is given, or null */
		public Node getDefaultChild() {
			return theDefaultChild;
		}

		/** @return Whether this command has no subcommands */
		public boolean isLeaf() {
			return theChildren.isEmpty();
		}

		/**
		 * @param name The name given on the command line
		 * @return The subcommand with the given name or alias, or null if there is none
		 */
		public Node getChild(String name) {
			for (Node child : theChildren) {
				if (child.theDefinition.isNamed(name))
					return child;
			}
			return null;
		}

		/** @return The matcher for this command's arguments */
		public ArgumentMatcher getMatcher() {
			return theMatcher;
		}

		/** @return The commands from the root down to this one */
		public List<Node> getPath() {
			List<Node> path = new ArrayList<>();
			for (Node node = this; node != null; node = node.theParent)
				path.add(0, node);
			return path;
		}

		@Override
		public String toString() {
			return theParent == null ? getName() : theParent + " " + getName();
		}
	}

	private final Node theRoot;

	private CommandTree(Node root) {
		theRoot = root;
	}

	/**
	 * Resolves the subcommands of a root command and validates the arguments of each command
	 *
	 * @param root The root command
	 * @return The command tree
	 * @throws ArgumentDefinitionException If a command is its own descendant, or a command's arguments are inconsistent
	 */
	public static CommandTree of(CommandDefinition root) throws ArgumentDefinitionException {
		Set<CommandDefinition> onPath = Collections.newSetFromMap(new IdentityHashMap<>());
		Set<CommandDefinition> validated = Collections.newSetFromMap(new IdentityHashMap<>());
		Node rootNode = buildNode(root, null, onPath, new ArrayList<>(), validated);
		if (log.isDebugEnabled())
			log.debug("Built command tree for " + root.getName() + " with " + validated.size() + " distinct command(s)");
		return new CommandTree(rootNode);
	}

	private static Node buildNode(CommandDefinition definition, Node parent, Set<CommandDefinition> onPath, List<String> pathNames,
		Set<CommandDefinition> validated) throws ArgumentDefinitionException {
		pathNames.add(definition.getName());
		if (!onPath.add(definition))
			throw new ArgumentDefinitionException(
				"Command '" + definition.getName() + "' is its own descendant: " + String.join(" -> ", pathNames));
		try {
			if (validated.add(definition))
				ArgumentSetValidation.validateOrThrow(definition.getName(), definition.getArguments(), definition.getBackingKeys());
			Node node = new Node(definition, parent);
			Set<String> childNames = new LinkedHashSet<>();
			for (Supplier<? extends CommandDefinition> sub : definition.getSubcommands()) {
				CommandDefinition subDef = sub.get();
				if (subDef == null)
					throw new ArgumentDefinitionException("Null subcommand supplied for '" + definition.getName() + "'");
				if (!childNames.add(subDef.getName()))
					throw new ArgumentDefinitionException(
						"Command '" + definition.getName() + "' has multiple subcommands named '" + subDef.getName() + "'");
				node.theChildren.add(buildNode(subDef, node, onPath, pathNames, validated));
			}
			if (definition.getDefaultSubcommand() != null) {
				node.theDefaultChild = node.getChild(definition.getDefaultSubcommand());
				if (node.theDefaultChild == null)
					throw new ArgumentDefinitionException("Default subcommand '" + definition.getDefaultSubcommand() + "' of '"
						+ definition.getName() + "' is not one of its subcommands");
			}
			return node;
		} finally {
			onPath.remove(definition);
			pathNames.remove(pathNames.size() - 1);
		}
	}

	/** @return The root command */
	public Node getRoot() {
		return theRoot;
	}

	/** @return All commands in the tree, depth-first in declaration order */
	public List<Node> getAllNodes() {
		List<Node> nodes = new ArrayList<>();
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(theRoot);
		while (!stack.isEmpty()) {
			Node node = stack.pop();
			nodes.add(node);
			for (int i = node.theChildren.size() - 1; i >= 0; i--)
				stack.push(node.theChildren.get(i));
		}
		return nodes;
	}

	/**
	 * @param command The command to find
	 * @return The commands from the root down to the first (breadth-first) occurrence of the given command, or an empty list if it is not
	 *         in the tree
	 */
	public List<Node> path(CommandDefinition command) {
		Deque<Node> queue = new ArrayDeque<>();
		queue.add(theRoot);
		while (!queue.isEmpty()) {
			Node node = queue.poll();
			if (node.theDefinition == command)
				return node.getPath();
			queue.addAll(node.theChildren);
		}
		return Collections.emptyList();
	}

	/**
	 * @param names Subcommand names, as given on the command line after the root command
	 * @return The commands from the root down through each named subcommand, stopping at the first name that does not match
	 */
	public List<Node> commandStack(List<String> names) {
		Node node = theRoot;
		for (String name : names) {
			Node child = node.getChild(name);
			if (child == null)
				break;
			node = child;
		}
		return node.getPath();
	}
}
