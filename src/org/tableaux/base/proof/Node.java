package org.tableaux.base.proof;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedSet;
import java.util.TreeSet;

import org.tableaux.base.util.lex.Sentence;

import com.google.common.collect.ImmutableMap;

/**
 * A tableau node: an immutable bag of properties.
 *
 * Nodes compare by identity.  The same sentence may appear in two distinct nodes, and a node may be shared by several
 * branches after a fork.
 */
public final class Node
{
  public static final String SENTENCE   = "sentence";
  public static final String DESIGNATED = "designated";
  public static final String WORLD      = "world";
  public static final String WORLD1     = "world1";
  public static final String WORLD2     = "world2";
  public static final String IS_FLAG    = "is_flag";
  public static final String FLAG       = "flag";
  public static final String INFO       = "info";
  public static final String CLOSURE    = "closure";

  /**
   * Flag value of a node marking a branch on which a rule stopped at a bound.
   */
  public static final String QUIT_FLAG  = "quit";

  private final ImmutableMap<String, Object> mProps;

  private Node(Map<String, ?> xiProps)
  {
    ImmutableMap.Builder<String, Object> lBuilder = ImmutableMap.builder();
    for (Entry<String, ?> lEntry : xiProps.entrySet())
    {
      if (lEntry.getValue() != null)
      {
        lBuilder.put(lEntry.getKey(), lEntry.getValue());
      }
    }
    mProps = lBuilder.build();
  }

  /**
   * Create a node from a property map.  Null values are dropped.
   */
  public static Node of(Map<String, ?> xiProps)
  {
    return new Node(xiProps);
  }

  /**
   * @return a property map builder.
   */
  public static Props props()
  {
    return new Props();
  }

  /**
   * Sentence node.
   */
  public static Node snode(Sentence xiSentence)
  {
    return props().sentence(xiSentence).node();
  }

  /**
   * Sentence node with a designation.
   */
  public static Node sdnode(Sentence xiSentence, boolean xiDesignated)
  {
    return props().sentence(xiSentence).designated(xiDesignated).node();
  }

  /**
   * Sentence node at a world.  If the world is null, the node is unmodal.
   */
  public static Node swnode(Sentence xiSentence, Integer xiWorld)
  {
    return props().sentence(xiSentence).world(xiWorld).node();
  }

  /**
   * Access node for world1 R world2.
   */
  public static Node anode(int xiWorld1, int xiWorld2)
  {
    return props().world1(xiWorld1).world2(xiWorld2).node();
  }

  /**
   * The node marking a closed branch.
   */
  public static Node closureNode()
  {
    return props().put(CLOSURE, true).put(FLAG, "closure").put(IS_FLAG, true).node();
  }

  /**
   * A flag node.
   *
   * @param xiFlag - the flag name.
   * @param xiInfo - descriptive info, or null.
   */
  public static Node flagNode(String xiFlag, String xiInfo)
  {
    return props().put(IS_FLAG, true).put(FLAG, xiFlag).put(INFO, xiInfo).node();
  }

  public ImmutableMap<String, Object> getProps()
  {
    return mProps;
  }

  public Object get(String xiKey)
  {
    return mProps.get(xiKey);
  }

  public boolean has(String xiKey)
  {
    return mProps.containsKey(xiKey);
  }

  public Sentence getSentence()
  {
    return (Sentence)mProps.get(SENTENCE);
  }

  public Boolean getDesignated()
  {
    return (Boolean)mProps.get(DESIGNATED);
  }

  public Integer getWorld()
  {
    return (Integer)mProps.get(WORLD);
  }

  public Integer getWorld1()
  {
    return (Integer)mProps.get(WORLD1);
  }

  public Integer getWorld2()
  {
    return (Integer)mProps.get(WORLD2);
  }

  public String getFlag()
  {
    return (String)mProps.get(FLAG);
  }

  public String getInfo()
  {
    return (String)mProps.get(INFO);
  }

  public boolean isClosure()
  {
    return Boolean.TRUE.equals(mProps.get(CLOSURE));
  }

  public boolean isFlag()
  {
    return Boolean.TRUE.equals(mProps.get(IS_FLAG));
  }

  /**
   * @return whether the node has any world property.
   */
  public boolean isModal()
  {
    return has(WORLD) || has(WORLD1) || has(WORLD2);
  }

  /**
   * @return whether this is an access node, i.e. it has both world1 and world2.
   */
  public boolean isAccess()
  {
    return has(WORLD1) && has(WORLD2);
  }

  /**
   * @return the worlds mentioned by the node.
   */
  public SortedSet<Integer> getWorlds()
  {
    SortedSet<Integer> lWorlds = new TreeSet<>();
    for (String lKey : new String[] {WORLD, WORLD1, WORLD2})
    {
      Integer lWorld = (Integer)mProps.get(lKey);
      if (lWorld != null)
      {
        lWorlds.add(lWorld);
      }
    }
    return lWorlds;
  }

  /**
   * @return whether every given property is present on this node with an equal value.
   */
  public boolean meets(Map<String, ?> xiProps)
  {
    for (Entry<String, ?> lEntry : xiProps.entrySet())
    {
      Object lValue = mProps.get(lEntry.getKey());
      if (lValue == null || !lValue.equals(lEntry.getValue()))
      {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString()
  {
    return "Node" + mProps;
  }

  /**
   * Builder of node property maps, also used as search criteria.  Null values are skipped.
   */
  public static final class Props
  {
    private final Map<String, Object> mMap = new LinkedHashMap<>();

    public Props put(String xiKey, Object xiValue)
    {
      if (xiValue != null)
      {
        mMap.put(xiKey, xiValue);
      }
      return this;
    }

    public Props sentence(Sentence xiSentence)
    {
      return put(SENTENCE, xiSentence);
    }

    public Props designated(Boolean xiDesignated)
    {
      return put(DESIGNATED, xiDesignated);
    }

    public Props world(Integer xiWorld)
    {
      return put(WORLD, xiWorld);
    }

    public Props world1(Integer xiWorld)
    {
      return put(WORLD1, xiWorld);
    }

    public Props world2(Integer xiWorld)
    {
      return put(WORLD2, xiWorld);
    }

    public Map<String, Object> map()
    {
      return mMap;
    }

    public Node node()
    {
      return new Node(mMap);
    }
  }
}
